package com.example.paginated.list;

/**
 * Hints how many source items to request so that, after mapping or filtering,
 * roughly {@code limit} items come out.
 *
 * <p>Only a performance knob: a bad estimate costs extra round trips, never correctness.
 *
 * @param <F> the filter type
 * @param <O> the order-by type
 */
@FunctionalInterface
public interface FetchSizeEstimator<F, O> {

    int estimate(F filter, O orderBy, int limit);

    /**
     * Requests as many source items as result items were asked for.
     */
    static <F, O> FetchSizeEstimator<F, O> sameAsLimit() {
        return (filter, orderBy, limit) -> limit;
    }

    /**
     * Requests {@code factor} times the limit, for filters that reject a known share of items.
     */
    static <F, O> FetchSizeEstimator<F, O> scaled(double factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("factor must be positive: " + factor);
        }
        return (filter, orderBy, limit) -> (int) Math.min(Integer.MAX_VALUE, Math.ceil(limit * factor));
    }
}
