package com.example.docs.access.model;

/**
 * Why an access decision denied the request. Logged and audited, never returned to the caller.
 */
public enum DenyReason {
    UNAUTHENTICATED,
    NOT_A_WORKSPACE_MEMBER,
    PRIVATE_RESOURCE,
    NO_SHARE,
    INSUFFICIENT_SHARE,
    INSUFFICIENT_ROLE,
    PUBLIC_ACCESS_DISABLED,
    MISCONFIGURED
}
