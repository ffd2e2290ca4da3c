package com.example.docs.access.engine;

import com.example.docs.access.model.SharePermission;
import reactor.core.publisher.Mono;

/**
 * Finds the active (not soft-deleted) share a user holds on a resource.
 */
@FunctionalInterface
public interface ShareLookup {

    /**
     * @return the permission of the first active share, or empty when there is none
     */
    Mono<SharePermission> findActiveShare(String resourceId, String userId);
}
