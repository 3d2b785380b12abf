package com.teknorix.jobcatalog.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequiresAdministrator}. Validated claims are exposed to the handler under
 * {@link #CLAIMS_ATTRIBUTE}.
 */
@Component
public class BearerTokenInterceptor implements HandlerInterceptor {
    public static final String CLAIMS_ATTRIBUTE = BearerTokenInterceptor.class.getName() + ".claims";
    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialService credentialService;

    public BearerTokenInterceptor(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod) || !requiresAdministrator((HandlerMethod) handler)) {
            return true;
        }
        String token = bearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            throw new TokenRejectedException();
        }
        TokenClaims claims = credentialService.validateToken(token);
        if (!claims.hasRole(CredentialService.ROLE_ADMINISTRATOR)) {
            throw new TokenRejectedException();
        }
        request.setAttribute(CLAIMS_ATTRIBUTE, claims);
        return true;
    }

    private boolean requiresAdministrator(HandlerMethod handlerMethod) {
        return handlerMethod.hasMethodAnnotation(RequiresAdministrator.class)
            || AnnotatedElementUtils.hasAnnotation(handlerMethod.getBeanType(), RequiresAdministrator.class);
    }

    static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
