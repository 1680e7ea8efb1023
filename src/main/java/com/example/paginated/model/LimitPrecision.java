package com.example.paginated.model;

/**
 * How strictly a query result must honour the requested limit.
 *
 * <table>
 *   <tr><th>Precision</th><th>Result size</th><th>Underlying fetches</th></tr>
 *   <tr><td>EXACT</td><td>exactly min(limit, available)</td><td>until satisfied, then trimmed</td></tr>
 *   <tr><td>AT_LEAST</td><td>limit or more, unless the boundary is reached</td><td>until satisfied</td></tr>
 *   <tr><td>AT_MOST</td><td>limit or fewer, still advancing when limit &gt; 0</td><td>one, then trimmed</td></tr>
 *   <tr><td>APPROXIMATE</td><td>no guarantee</td><td>one</td></tr>
 * </table>
 */
public enum LimitPrecision {
    EXACT(false, true),
    AT_LEAST(false, false),
    AT_MOST(true, true),
    APPROXIMATE(true, false);

    private final boolean singleFetch;
    private final boolean trimsExcess;

    LimitPrecision(boolean singleFetch, boolean trimsExcess) {
        this.singleFetch = singleFetch;
        this.trimsExcess = trimsExcess;
    }

    /**
     * Returns {@code true} if a query with this precision performs exactly one
     * underlying fetch, whether or not the limit was satisfied.
     */
    public boolean isSingleFetch() {
        return singleFetch;
    }

    /**
     * Returns {@code true} if entries beyond the limit are cut from the result.
     */
    public boolean trimsExcess() {
        return trimsExcess;
    }
}
