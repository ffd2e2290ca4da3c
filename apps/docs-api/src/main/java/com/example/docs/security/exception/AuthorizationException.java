package com.example.docs.security.exception;

import com.example.docs.access.model.AccessDecision;
import com.example.docs.access.model.DenyReason;
import lombok.Getter;

// Caller is known but may not perform the action. Maps to a uniform 403.
@Getter
public class AuthorizationException extends RuntimeException {

    private final DenyReason reason;

    public AuthorizationException(String message) {
        super(message);
        this.reason = null;
    }

    public AuthorizationException(AccessDecision decision) {
        super("Access denied by " + decision.rule() + ": " + decision.reason());
        this.reason = decision.reason();
    }
}
