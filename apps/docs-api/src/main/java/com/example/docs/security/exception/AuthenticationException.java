package com.example.docs.security.exception;

// Caller is anonymous or presented an unusable identity. Maps to 401.
public class AuthenticationException extends RuntimeException {

    public AuthenticationException(String message) {
        super(message);
    }
}
