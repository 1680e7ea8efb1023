package com.example.paginated.list;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a paginated list breaks one of its own contracts: a page that is not
 * sorted under the list's comparator, merged lists that disagree on how two items
 * compare, or a source that stops making progress.
 *
 * <p>These are wiring or implementation bugs, not user errors, and are never
 * recovered from. The context map carries whatever is needed to find the
 * misbehaving source.
 */
public class PaginationConsistencyException extends RuntimeException {

    private final Map<String, Object> context;

    public PaginationConsistencyException(String message, Map<String, ?> context) {
        super(message + " " + context);
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Returns the diagnostic context captured when the violation was detected.
     */
    public Map<String, Object> getContext() {
        return context;
    }
}
