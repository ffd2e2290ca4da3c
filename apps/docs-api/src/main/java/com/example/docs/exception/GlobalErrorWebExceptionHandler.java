package com.example.docs.exception;

import com.example.docs.common.dto.ErrorResponse;
import com.example.docs.common.util.StringSanitizer;
import com.example.docs.observability.filter.CorrelationIdFilter;
import com.example.docs.security.exception.AuthenticationException;
import com.example.docs.security.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to {@link ErrorResponse} bodies.
 *
 * <p>Every authorization failure gets the same 403 body. The deny reason is only logged.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    static final String ACCESS_DENIED_MESSAGE = "Access denied";

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();
        String correlationId = request.headers().firstHeader(CorrelationIdFilter.CORRELATION_ID_HEADER);

        if (error instanceof AuthenticationException) {
            log.warn("Authentication failed: path={}, error={}", path, error.getMessage());
            return createErrorResponse(HttpStatus.UNAUTHORIZED, ErrorResponse.of(
                    ErrorResponse.Categories.AUTHENTICATION_REQUIRED, ErrorResponse.Codes.UNAUTHORIZED,
                    "Authentication required", correlationId, path));
        }

        if (error instanceof AuthorizationException authz) {
            log.warn("Authorization denied: path={}, reason={}, error={}", path, authz.getReason(), error.getMessage());
            return createErrorResponse(HttpStatus.FORBIDDEN, ErrorResponse.of(
                    ErrorResponse.Categories.ACCESS_DENIED, ErrorResponse.Codes.FORBIDDEN,
                    ACCESS_DENIED_MESSAGE, correlationId, path));
        }

        if (error instanceof ResourceNotFoundException notFound) {
            log.debug("Not found: path={}, type={}, id={}",
                    path, notFound.getResourceType(), StringSanitizer.forLog(notFound.getResourceId()));
            return createErrorResponse(HttpStatus.NOT_FOUND, ErrorResponse.of(
                    ErrorResponse.Categories.NOT_FOUND, ErrorResponse.Codes.RESOURCE_NOT_FOUND,
                    notFound.getResourceType() + " not found", correlationId, path));
        }

        // Validation errors -> 400
        if (error instanceof WebExchangeBindException bindException) {
            Map<String, Object> fieldErrors = new LinkedHashMap<>();
            bindException.getFieldErrors().forEach(fe ->
                    fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage()));

            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);

            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.of(
                    ErrorResponse.Categories.VALIDATION_ERROR, ErrorResponse.Codes.INVALID_REQUEST,
                    "Validation failed", correlationId, path, Map.of("fields", fieldErrors)));
        }

        if (error instanceof DuplicateKeyException) {
            log.warn("Duplicate key: path={}, error={}", path, error.getMessage());
            return createErrorResponse(HttpStatus.CONFLICT, ErrorResponse.of(
                    ErrorResponse.Categories.CONFLICT, ErrorResponse.Codes.DUPLICATE_RESOURCE,
                    "Resource already exists", correlationId, path));
        }

        // ResponseStatusException -> use its status
        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            String message = statusException.getReason() != null
                    ? statusException.getReason()
                    : status.getReasonPhrase();
            return createErrorResponse(status, ErrorResponse.of(
                    categoryFor(status), status.name(), message, correlationId, path));
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.of(
                    ErrorResponse.Categories.VALIDATION_ERROR, ErrorResponse.Codes.INVALID_REQUEST,
                    "Invalid request parameter", correlationId, path));
        }

        log.error("Unhandled error: path={}, error={}", path, error.getMessage(), error);

        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.of(
                ErrorResponse.Categories.INTERNAL_ERROR, ErrorResponse.Codes.INTERNAL_ERROR,
                "An unexpected error occurred", correlationId, path));
    }

    private static String categoryFor(HttpStatus status) {
        return switch (status) {
            case UNAUTHORIZED -> ErrorResponse.Categories.AUTHENTICATION_REQUIRED;
            case FORBIDDEN -> ErrorResponse.Categories.ACCESS_DENIED;
            case NOT_FOUND -> ErrorResponse.Categories.NOT_FOUND;
            case CONFLICT -> ErrorResponse.Categories.CONFLICT;
            default -> status.is4xxClientError()
                    ? ErrorResponse.Categories.VALIDATION_ERROR
                    : ErrorResponse.Categories.INTERNAL_ERROR;
        };
    }

    private Mono<ServerResponse> createErrorResponse(HttpStatus status, ErrorResponse body) {
        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
