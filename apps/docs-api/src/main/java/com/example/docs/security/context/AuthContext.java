package com.example.docs.security.context;

/**
 * Authenticated caller, as asserted by the gateway.
 */
public record AuthContext(
        String userId,
        String email
) {
    public static AuthContext of(String userId) {
        return new AuthContext(userId, null);
    }
}
