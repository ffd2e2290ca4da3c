package com.example.docs.access.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of access recorded in the access log.
 */
public enum AccessType {
    VIEW("view"),
    EDIT("edit"),
    ADMIN_VIEW("admin_view"),
    SHARE("share"),
    UNSHARE("unshare"),
    LOCK("lock"),
    UNLOCK("unlock"),
    ARCHIVE("archive"),
    RESTORE("restore");

    private final String value;

    AccessType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
