package com.desweep.core.model;

/**
 * Final judgment for one dependency. {@link #UNKNOWN} is never treated as safe.
 */
public enum Classification {
    SAFE_TO_DELETE,
    REQUIRES_REVIEW,
    UNKNOWN
}
