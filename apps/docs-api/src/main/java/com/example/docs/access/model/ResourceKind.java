package com.example.docs.access.model;

public enum ResourceKind {
    DOCUMENT("Document"),
    WIKI_PAGE("Wiki page");

    private final String displayName;

    ResourceKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
