package org.example.helpdesk.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import org.example.helpdesk.entity.UserRole;

import java.time.LocalDateTime;
import java.util.List;

/**
 * JSON body returned for every failed request.
 * The role fields are only present on role guard rejections.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private LocalDateTime timestamp;
    private int status;
    private String error;
    private String message;
    private String path;

    @JsonProperty("user_role")
    private UserRole userRole;

    @JsonProperty("required_roles")
    private List<UserRole> requiredRoles;

    public ErrorResponse(LocalDateTime timestamp, int status, String error, String message, String path) {
        this.timestamp = timestamp;
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }
}
