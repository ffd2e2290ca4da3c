package com.example.docs.access.model;

/**
 * Result of evaluating access to a resource.
 *
 * @param decision         ALLOW or DENY
 * @param rule             short id of the rule that decided, for logs and audit
 * @param reason           why access was denied, {@code null} when allowed
 * @param adminPrivateView set when a workspace admin reads a private resource they do not own
 */
public record AccessDecision(
        Decision decision,
        String rule,
        DenyReason reason,
        boolean adminPrivateView
) {
    public enum Decision {
        ALLOW,
        DENY
    }

    public static AccessDecision allow(String rule) {
        return new AccessDecision(Decision.ALLOW, rule, null, false);
    }

    /**
     * Allow, flagged for the admin-private-view audit entry.
     */
    public static AccessDecision allowAdminPrivateView(String rule) {
        return new AccessDecision(Decision.ALLOW, rule, null, true);
    }

    public static AccessDecision deny(String rule, DenyReason reason) {
        return new AccessDecision(Decision.DENY, rule, reason, false);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isDenied() {
        return decision == Decision.DENY;
    }
}
