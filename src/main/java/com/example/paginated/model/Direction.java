package com.example.paginated.model;

/**
 * Traversal direction of a paginated query.
 */
public enum Direction {

    /**
     * Walk towards the end of the list, starting strictly after the cursor.
     */
    NEXT,

    /**
     * Walk towards the start of the list, ending strictly before the cursor.
     */
    PREV;

    /**
     * Returns {@code true} if a page with the given flags touches the boundary
     * this direction walks towards.
     */
    public boolean reachedBoundary(boolean isFirst, boolean isLast) {
        return this == NEXT ? isLast : isFirst;
    }
}
