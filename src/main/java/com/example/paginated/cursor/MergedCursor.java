package com.example.paginated.cursor;

import java.util.List;

/**
 * Position in a merged list: one cursor per constituent list, in constituent order.
 *
 * <p>Only meaningful to the merged list that produced it. Use {@link MergedCursorCodec}
 * to turn it into a string when it has to leave the process.
 */
public record MergedCursor(List<Object> cursors) {

    public MergedCursor {
        cursors = List.copyOf(cursors);
    }

    public static MergedCursor of(Object... cursors) {
        return new MergedCursor(List.of(cursors));
    }

    public int size() {
        return cursors.size();
    }

    public Object get(int index) {
        return cursors.get(index);
    }
}
