package com.gt.lrs.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Builds the security context from headers set upstream. A request carrying the configured API key is a service call;
 * otherwise a positive numeric user id header makes it a user call, with the id as the principal.
 */
@Component
public class UpstreamAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(UpstreamAuthFilter.class);

    public static final String USER_ROLE = "USER";
    public static final String SERVICE_ROLE = "SERVICE";
    public static final String SERVICE_PRINCIPAL = "service";

    private final String userIdHeader;
    private final String apiKeyHeader;
    private final byte[] apiKey;

    @Autowired
    public UpstreamAuthFilter(@Value("${lrs.auth.userIdHeader:X-User-Id}") String userIdHeader,
                              @Value("${lrs.auth.apiKeyHeader:X-Api-Key}") String apiKeyHeader,
                              @Value("${lrs.auth.apiKey:}") String apiKey) {
        this.userIdHeader = userIdHeader;
        this.apiKeyHeader = apiKeyHeader;
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        String presentedApiKey = request.getHeader(apiKeyHeader);
        String userIdValue = request.getHeader(userIdHeader);

        if (presentedApiKey != null && !presentedApiKey.isBlank()) {
            if (isValidApiKey(presentedApiKey)) {
                authenticate(request, SERVICE_PRINCIPAL, SERVICE_ROLE);
            } else {
                log.warn("Request to {} with invalid API key", request.getRequestURI());
            }
        } else if (userIdValue != null && !userIdValue.isBlank()) {
            Long userId = parseUserId(userIdValue);
            if (userId != null) {
                authenticate(request, userId, USER_ROLE);
            } else {
                log.warn("Request to {} with invalid user id header '{}'", request.getRequestURI(), userIdValue);
            }
        }

        filterChain.doFilter(request, response);
    }

    private boolean isValidApiKey(String presentedApiKey) {
        return apiKey.length > 0 && MessageDigest.isEqual(apiKey, presentedApiKey.getBytes(StandardCharsets.UTF_8));
    }

    private static Long parseUserId(String userIdValue) {
        try {
            long userId = Long.parseLong(userIdValue.trim());
            return userId > 0 ? userId : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static void authenticate(HttpServletRequest request, Object principal, String role) {
        UsernamePasswordAuthenticationToken authenticationToken =
                new UsernamePasswordAuthenticationToken(principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + role)));
        authenticationToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authenticationToken);
    }
}
