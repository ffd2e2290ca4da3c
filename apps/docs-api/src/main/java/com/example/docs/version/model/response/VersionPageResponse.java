package com.example.docs.version.model.response;

import java.util.List;

/**
 * One page of a resource's versions, newest first.
 *
 * @param count      total number of versions
 * @param nextOffset offset of the next page, {@code null} on the last page
 */
public record VersionPageResponse(
        List<VersionResponse> results,
        long count,
        Integer nextOffset
) {}
