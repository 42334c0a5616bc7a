package org.example.helpdesk.config;

import lombok.RequiredArgsConstructor;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.entity.UserRole;
import org.example.helpdesk.security.BearerAuthenticationInterceptor;
import org.example.helpdesk.security.RequestIdentityArgumentResolver;
import org.example.helpdesk.security.RoleGuardInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Wires authentication and role checks into Spring MVC.
 *
 * <p>Both checks run as interceptors so that their exceptions reach
 * {@code GlobalExceptionHandler}. Order matters: the role guard reads the
 * identity the authenticator publishes.</p>
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    static final String[] PUBLIC_PATHS = {
            "/api/v1/auth/login",
            "/api/v1/auth/register",
            "/api/v1/auth/refresh",
            "/api/v1/auth/logout",
            "/api/v1/health"
    };

    private final BearerAuthenticationInterceptor bearerAuthenticationInterceptor;
    private final RoleGuardInterceptor roleGuardInterceptor;
    private final RequestIdentityArgumentResolver requestIdentityArgumentResolver;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(bearerAuthenticationInterceptor)
                .addPathPatterns("/api/v1/**")
                .excludePathPatterns(PUBLIC_PATHS)
                .order(1);
        registry.addInterceptor(roleGuardInterceptor)
                .addPathPatterns("/api/v1/**")
                .excludePathPatterns(PUBLIC_PATHS)
                .order(2);
    }

    /**
     * Query parameters use the lower-case wire values, e.g. {@code ?role=end_user}.
     */
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, UserRole.class, UserRole::fromJson);
        registry.addConverter(String.class, TicketStatus.class, TicketStatus::fromJson);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(requestIdentityArgumentResolver);
    }
}
