package com.example.docs.security.filter;

import com.example.docs.common.util.StringSanitizer;
import com.example.docs.config.properties.DocsProperties;
import com.example.docs.security.context.AuthContext;
import com.example.docs.security.context.AuthContextHolder;
import com.example.docs.security.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Reads the caller identity that the upstream gateway puts on every request after OIDC login.
 *
 * <p>No identity header: the request continues anonymously and fails later with a 401 when a
 * handler asks for the {@link AuthContext}. A malformed identity is rejected immediately.
 * Only registered inside the {@code /api/v1/**} security chain.
 */
@Slf4j
public class GatewayAuthenticationFilter implements WebFilter {

    private static final int MAX_EMAIL_LENGTH = 254;

    private final String userIdHeader;
    private final String userEmailHeader;

    public GatewayAuthenticationFilter(DocsProperties properties) {
        this.userIdHeader = properties.gateway().userIdHeader();
        this.userEmailHeader = properties.gateway().userEmailHeader();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();

        String userId = request.getHeaders().getFirst(userIdHeader);
        if (userId == null || userId.isBlank()) {
            log.debug("No {} header, continuing anonymously: path={}", userIdHeader, request.getPath().value());
            return chain.filter(exchange);
        }

        userId = userId.trim();
        if (!StringSanitizer.isValidUserId(userId)) {
            log.warn("Rejected malformed {} header: {}", userIdHeader, StringSanitizer.forLog(userId));
            return Mono.error(new AuthenticationException("Invalid user identity"));
        }

        String email = StringSanitizer.truncate(request.getHeaders().getFirst(userEmailHeader), MAX_EMAIL_LENGTH);
        if (email != null && email.isBlank()) {
            email = null;
        }

        AuthContext authContext = new AuthContext(userId, email);
        log.debug("Gateway authenticated: userId={}", StringSanitizer.forLog(userId));

        return chain.filter(exchange)
                .contextWrite(AuthContextHolder.withContext(authContext));
    }
}
