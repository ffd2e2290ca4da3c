package com.example.docs.access.model;

/**
 * What the access evaluator needs to know about a document or wiki page.
 * Share lookups go through the resource's store, see
 * {@link com.example.docs.resource.store.ResourceStore#findActiveShare(String, String)}.
 */
public interface ShareableResource {

    String getId();

    String getWorkspaceId();

    ResourceKind kind();

    /**
     * Id of the owning user, or {@code null} for a misconfigured record.
     */
    String getOwnedBy();

    /**
     * Access level, or {@code null} for a misconfigured record.
     */
    AccessLevel getAccess();
}
