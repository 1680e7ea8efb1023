package com.example.paginated.model;

import java.util.Objects;

/**
 * One item of a page together with the cursor positioned at that item.
 *
 * <p>Passing {@code itemCursor} as the {@code after} cursor of a forward query
 * continues strictly after the item; passing it as the {@code before} cursor of
 * a backward query continues strictly before it.
 *
 * @param <T> the item type
 * @param <C> the cursor type
 */
public record PageEntry<T, C>(T item, C itemCursor) {

    public PageEntry {
        Objects.requireNonNull(itemCursor, "itemCursor must not be null");
    }
}
