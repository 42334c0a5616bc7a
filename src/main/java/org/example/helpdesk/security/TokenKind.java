package org.example.helpdesk.security;

public enum TokenKind {
    ACCESS,
    REFRESH
}
