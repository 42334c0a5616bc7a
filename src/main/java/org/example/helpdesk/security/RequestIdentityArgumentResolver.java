package org.example.helpdesk.security;

import org.example.helpdesk.exception.UnauthenticatedException;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the {@link RequestIdentity} published by {@link BearerAuthenticationInterceptor}
 * to controller parameters of that type.
 */
@Component
public class RequestIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return RequestIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public RequestIdentity resolveArgument(MethodParameter parameter,
                                           ModelAndViewContainer mavContainer,
                                           NativeWebRequest webRequest,
                                           WebDataBinderFactory binderFactory) {
        Object identity = webRequest.getAttribute(RequestIdentity.ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (identity instanceof RequestIdentity) {
            return (RequestIdentity) identity;
        }
        throw new UnauthenticatedException("User not authenticated");
    }
}
