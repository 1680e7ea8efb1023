package com.example.paginated.list;

/**
 * Compares two items under a caller-defined ordering.
 *
 * @param <O> the order-by type
 * @param <T> the item type
 */
@FunctionalInterface
public interface OrderComparator<O, T> {

    /**
     * Returns a negative number, zero or a positive number as {@code a} sorts
     * before, together with or after {@code b} under {@code orderBy}.
     */
    int compare(O orderBy, T a, T b);
}
