package org.example.helpdesk.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.exception.ForbiddenException;
import org.example.helpdesk.exception.UnauthenticatedException;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;
import java.util.List;

/**
 * Enforces {@link RequireRole} on handler methods and controller classes.
 * Handlers without the annotation only need an authenticated caller.
 */
@Slf4j
@Component
public class RoleGuardInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }

        RequireRole requireRole = findRequireRole((HandlerMethod) handler);
        if (requireRole == null) {
            return true;
        }

        Object attribute = request.getAttribute(RequestIdentity.ATTRIBUTE);
        if (!(attribute instanceof RequestIdentity) || ((RequestIdentity) attribute).role() == null) {
            throw new UnauthenticatedException("User role not found in context");
        }
        RequestIdentity identity = (RequestIdentity) attribute;

        List<UserRole> allowed = Arrays.asList(requireRole.value());
        if (!allowed.contains(identity.role())) {
            log.warn("[ROLE_DENIED] {} {} | userId={} | role={} | required={}",
                    request.getMethod(), request.getRequestURI(), identity.userId(), identity.role(), allowed);
            throw new ForbiddenException(identity.role(), allowed);
        }
        return true;
    }

    private RequireRole findRequireRole(HandlerMethod handlerMethod) {
        RequireRole onMethod = AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getMethod(), RequireRole.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequireRole.class);
    }
}
