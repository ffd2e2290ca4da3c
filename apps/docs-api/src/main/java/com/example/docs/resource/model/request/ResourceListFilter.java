package com.example.docs.resource.model.request;

import com.example.docs.access.model.AccessLevel;

/**
 * Query filters for listing resources.
 *
 * @param collection collection id, or {@code none} for resources outside any collection
 * @param parent     parent id, or {@code root} for top-level resources
 * @param access     only resources with this access level, {@code null} for any
 * @param archived   {@code true} for archived only, {@code false} for live only, {@code null} for both
 * @param ownedByMe  only resources the caller owns
 */
public record ResourceListFilter(
        String collection,
        String parent,
        AccessLevel access,
        Boolean archived,
        boolean ownedByMe
) {
    public static final String NO_COLLECTION = "none";
    public static final String ROOT = "root";

    public static ResourceListFilter none() {
        return new ResourceListFilter(null, null, null, null, false);
    }
}
