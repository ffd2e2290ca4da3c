package com.example.docs.access.model;

import java.util.Arrays;

/**
 * Role of a member inside a workspace.
 *
 * <p>Each role keeps the numeric code it is stored with. Roles are compared through
 * {@link #isAtLeast(WorkspaceRole)}, never through raw codes.
 */
public enum WorkspaceRole {
    GUEST(5),
    MEMBER(15),
    ADMIN(20);

    private final int code;

    WorkspaceRole(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isAtLeast(WorkspaceRole other) {
        return this.code >= other.code;
    }

    public boolean isAdmin() {
        return this == ADMIN;
    }

    public static WorkspaceRole fromCode(int code) {
        return Arrays.stream(values())
                .filter(role -> role.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown workspace role code: " + code));
    }
}
