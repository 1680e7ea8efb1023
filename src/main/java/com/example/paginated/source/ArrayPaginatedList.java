package com.example.paginated.source;

import com.example.paginated.list.PaginatedList;
import com.example.paginated.model.Direction;
import com.example.paginated.model.PageEntry;
import com.example.paginated.model.QueryOptions;
import com.example.paginated.model.QueryResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A paginated list over an in-memory snapshot of items.
 *
 * <p>The filter is a {@link Predicate} and the ordering a {@link Comparator}; every fetch
 * filters and stably sorts the snapshot, then slices it. Cursors are {@value #FIRST},
 * {@value #LAST}, or the decimal index of an item in the filtered, sorted view.
 *
 * <p>Example usage:
 * <pre>{@code
 * ArrayPaginatedList<Integer> list = new ArrayPaginatedList<>(List.of(5, 3, 1, 4, 2));
 *
 * QueryResult<Integer, String> page = list.next(
 *     list.getFirstCursor(), x -> x % 2 == 1, Comparator.naturalOrder(), 10, LimitPrecision.EXACT
 * ).join();
 *
 * // page.items() == [1, 3, 5]
 * }</pre>
 *
 * @param <T> the item type
 */
public class ArrayPaginatedList<T> extends PaginatedList<T, String, Predicate<T>, Comparator<T>> {

    public static final String FIRST = "first";
    public static final String LAST = "last";

    private final List<T> items;

    /**
     * @param items the items, copied; the list does not see later changes to it
     */
    public ArrayPaginatedList(List<T> items) {
        this.items = List.copyOf(items);
    }

    @Override
    protected String doGetFirstCursor() {
        return FIRST;
    }

    @Override
    protected String doGetLastCursor() {
        return LAST;
    }

    @Override
    protected int doCompare(Comparator<T> orderBy, T a, T b) {
        return orderBy.compare(a, b);
    }

    @Override
    protected CompletableFuture<QueryResult<T, String>> doNextOrPrev(
            Direction direction,
            QueryOptions<String, Predicate<T>, Comparator<T>> options
    ) {
        List<T> view = items.stream()
                .filter(options.filter())
                .sorted(options.orderBy())
                .collect(Collectors.toList());
        int size = view.size();
        int position = parseCursor(options.cursor(), size);

        int start;
        int end;
        if (direction == Direction.NEXT) {
            start = FIRST.equals(options.cursor()) ? 0 : Math.min(position + 1, size);
            end = (int) Math.min((long) start + options.limit(), size);
        } else {
            end = position;
            start = Math.max(0, end - options.limit());
        }

        List<PageEntry<T, String>> entries = new ArrayList<>(end - start);
        for (int i = start; i < end; i++) {
            entries.add(new PageEntry<>(view.get(i), String.valueOf(i)));
        }

        String cursor;
        if (!entries.isEmpty()) {
            cursor = direction == Direction.NEXT
                    ? entries.get(entries.size() - 1).itemCursor()
                    : entries.get(0).itemCursor();
        } else if (direction == Direction.NEXT && end == size) {
            cursor = LAST;
        } else if (direction == Direction.PREV && start == 0) {
            cursor = FIRST;
        } else {
            cursor = options.cursor();
        }

        return CompletableFuture.completedFuture(new QueryResult<>(entries, start == 0, end == size, cursor));
    }

    /**
     * Returns the view index the cursor sits at: {@code 0} for {@value #FIRST},
     * {@code size} for {@value #LAST}, the item index (clamped to {@code size}) otherwise.
     */
    private static int parseCursor(String cursor, int size) {
        if (FIRST.equals(cursor)) {
            return 0;
        }
        if (LAST.equals(cursor)) {
            return size;
        }
        int index;
        try {
            index = Integer.parseInt(cursor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed cursor: " + cursor, e);
        }
        if (index < 0) {
            throw new IllegalArgumentException("Malformed cursor: " + cursor);
        }
        return Math.min(index, size);
    }
}
