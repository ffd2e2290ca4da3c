package com.example.docs.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 *
 * <pre>{@code
 * {
 *   "error": "access_denied",
 *   "code": "FORBIDDEN",
 *   "message": "Access denied",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "path": "/api/v1/workspaces/acme/documents/123"
 * }
 * }</pre>
 *
 * @param error         stable error category for client error handling
 * @param code          specific error code
 * @param message       human-readable message
 * @param correlationId request correlation id
 * @param timestamp     when the error occurred
 * @param path          request path
 * @param details       extra context, only for validation errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        String correlationId,
        Instant timestamp,
        String path,
        Map<String, Object> details
) {
    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, null);
    }

    public static ErrorResponse of(
            String error,
            String code,
            String message,
            String correlationId,
            String path,
            Map<String, Object> details
    ) {
        return new ErrorResponse(error, code, message, correlationId, Instant.now(), path, details);
    }

    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String AUTHENTICATION_REQUIRED = "authentication_required";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String NOT_FOUND = "not_found";
        public static final String CONFLICT = "conflict";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        public static final String UNAUTHORIZED = "UNAUTHORIZED";
        public static final String FORBIDDEN = "FORBIDDEN";
        public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
        public static final String DUPLICATE_RESOURCE = "DUPLICATE_RESOURCE";
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private Codes() {
        }
    }
}
