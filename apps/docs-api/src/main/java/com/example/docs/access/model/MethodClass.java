package com.example.docs.access.model;

import org.springframework.http.HttpMethod;

/**
 * Coarse classification of a request: reads versus writes.
 */
public enum MethodClass {
    /**
     * Retrieve or list.
     */
    SAFE,

    /**
     * Create, update, delete and any other state-changing action.
     */
    MUTATING;

    public static MethodClass of(HttpMethod method) {
        if (HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method) || HttpMethod.OPTIONS.equals(method)) {
            return SAFE;
        }
        return MUTATING;
    }
}
