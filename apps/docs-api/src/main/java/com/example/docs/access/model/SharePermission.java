package com.example.docs.access.model;

import java.util.Arrays;

/**
 * Permission tier granted by a share.
 */
public enum SharePermission {
    VIEW(0),
    EDIT(1),
    ADMIN(2);

    private final int code;

    SharePermission(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean canEdit() {
        return this == EDIT || this == ADMIN;
    }

    public boolean canManageShares() {
        return this == ADMIN;
    }

    public static SharePermission fromCode(int code) {
        return Arrays.stream(values())
                .filter(value -> value.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown share permission code: " + code));
    }
}
