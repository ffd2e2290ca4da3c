package com.example.docs.observability.filter;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Gives every request a correlation id. Reuses {@code X-Correlation-Id} or {@code X-Request-Id}
 * when the caller sends a well-formed one, otherwise generates a UUID. The id is echoed on the
 * response, copied onto the request for the audit trail, and put into MDC and the Reactor context.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_KEY = "correlationId";

    private static final Pattern VALID_ID = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = extractOrGenerateCorrelationId(exchange.getRequest());
        String requestPath = exchange.getRequest().getPath().value();
        String requestMethod = exchange.getRequest().getMethod().name();

        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        ServerHttpRequest mutatedRequest = exchange.getRequest().mutate()
                .headers(headers -> headers.set(CORRELATION_ID_HEADER, correlationId))
                .build();

        return chain.filter(exchange.mutate().request(mutatedRequest).build())
                .contextWrite(Context.of(CORRELATION_ID_KEY, correlationId))
                .doFirst(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    log.debug("Request started: {} {}", requestMethod, requestPath);
                })
                .doFinally(signalType -> {
                    log.debug("Request completed: {} {} - {}", requestMethod, requestPath, signalType);
                    MDC.remove(CORRELATION_ID_KEY);
                });
    }

    private String extractOrGenerateCorrelationId(ServerHttpRequest request) {
        String correlationId = request.getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId != null && VALID_ID.matcher(correlationId.trim()).matches()) {
            return correlationId.trim();
        }

        String requestId = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId != null && VALID_ID.matcher(requestId.trim()).matches()) {
            return requestId.trim();
        }

        return UUID.randomUUID().toString();
    }

    public static Mono<String> getCorrelationId() {
        return Mono.deferContextual(ctx ->
                Mono.just(ctx.getOrDefault(CORRELATION_ID_KEY, "unknown")));
    }
}
