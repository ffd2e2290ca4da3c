package com.example.docs.access.model;

import java.util.Arrays;

/**
 * Visibility of a document or wiki page.
 */
public enum AccessLevel {
    /**
     * Disabled for this deployment. Resources in this state are denied to everyone.
     */
    PUBLIC(0),
    PRIVATE(1),
    SHARED(2);

    private final int code;

    AccessLevel(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static AccessLevel fromCode(int code) {
        return Arrays.stream(values())
                .filter(value -> value.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown access level code: " + code));
    }
}
