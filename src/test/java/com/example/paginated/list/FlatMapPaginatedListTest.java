package com.example.paginated.list;

import com.example.paginated.model.LimitPrecision;
import com.example.paginated.model.PageEntry;
import com.example.paginated.model.QueryResult;
import com.example.paginated.source.ArrayPaginatedList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for map, filter, addFilter and flatMap.
 *
 * <h2>What is checked</h2>
 * <ul>
 *   <li>Derived lists page exactly like their source, only with translated items</li>
 *   <li>Filters that reject most items still fill whole pages</li>
 *   <li>Fetch size estimates only change how often the source is asked</li>
 * </ul>
 */
class FlatMapPaginatedListTest {

    private static final Predicate<Integer> ALL = x -> true;
    private static final Comparator<Integer> ASC = Comparator.naturalOrder();

    private static ArrayPaginatedList<Integer> range(int fromInclusive, int toInclusive) {
        return new ArrayPaginatedList<>(IntStream.rangeClosed(fromInclusive, toInclusive).boxed().collect(Collectors.toList()));
    }

    // =========================================================================
    // MAP
    // =========================================================================

    @Test
    @DisplayName("Should map items while keeping the source cursors")
    void shouldMapItems() {
        ArrayPaginatedList<Integer> source = range(1, 7);
        PaginatedList<String, String, Predicate<Integer>, Comparator<Integer>> labels =
                source.<String, Predicate<Integer>, Comparator<Integer>>map(
                        n -> "item-" + n,
                        label -> Integer.parseInt(label.substring("item-".length())),
                        Function.identity(),
                        Function.identity()
                );

        QueryResult<String, String> mapped = labels.next(labels.getFirstCursor(), ALL, ASC, 3, LimitPrecision.EXACT).join();
        QueryResult<Integer, String> original = source.next(source.getFirstCursor(), ALL, ASC, 3, LimitPrecision.EXACT).join();

        assertThat(mapped.items()).containsExactly("item-1", "item-2", "item-3");
        assertThat(mapped.cursor()).isEqualTo(original.cursor());
        assertThat(mapped.isFirst()).isEqualTo(original.isFirst());
        assertThat(mapped.isLast()).isEqualTo(original.isLast());

        // Compared through the source ordering, not as strings
        assertThat(labels.compare(ASC, "item-9", "item-10")).isNegative();
    }

    @Test
    @DisplayName("Should walk a mapped list in both directions")
    void shouldWalkMappedListBothWays() {
        PaginatedList<String, String, Predicate<Integer>, Comparator<Integer>> labels =
                range(1, 7).<String, Predicate<Integer>, Comparator<Integer>>map(
                        n -> "item-" + n,
                        label -> Integer.parseInt(label.substring("item-".length())),
                        Function.identity(),
                        Function.identity()
                );

        QueryResult<String, String> tail = labels.prev(labels.getLastCursor(), ALL, ASC, 2, LimitPrecision.EXACT).join();
        QueryResult<String, String> before = labels.prev(tail.cursor(), ALL, ASC, 2, LimitPrecision.EXACT).join();

        assertThat(tail.items()).containsExactly("item-6", "item-7");
        assertThat(tail.isLast()).isTrue();
        assertThat(before.items()).containsExactly("item-4", "item-5");
    }

    // =========================================================================
    // FILTER
    // =========================================================================

    @Test
    @DisplayName("Should fill whole pages from a sparse filter in both directions")
    void shouldFillPagesFromSparseFilter() {
        // Given: multiples of a divisor, with the divisor as the filter
        PaginatedList<Integer, String, Integer, Comparator<Integer>> multiples = range(1, 20).filter(
                (item, divisor) -> item % divisor == 0,
                divisor -> ALL,
                FetchSizeEstimator.sameAsLimit()
        );

        // When
        List<List<Integer>> forward = new ArrayList<>();
        String cursor = multiples.getFirstCursor();
        QueryResult<Integer, String> page;
        do {
            page = multiples.next(cursor, 3, ASC, 4, LimitPrecision.EXACT).join();
            forward.add(page.items());
            cursor = page.cursor();
        } while (!page.isLast());

        List<Integer> backward = new ArrayList<>();
        cursor = multiples.getLastCursor();
        do {
            page = multiples.prev(cursor, 3, ASC, 4, LimitPrecision.EXACT).join();
            backward.addAll(0, page.items());
            cursor = page.cursor();
        } while (!page.isFirst());

        // Then
        assertThat(forward).containsExactly(List.of(3, 6, 9, 12), List.of(15, 18));
        assertThat(backward).containsExactly(3, 6, 9, 12, 15, 18);
    }

    @Test
    @DisplayName("Should still advance when the estimator asks for nothing")
    void shouldAdvanceWithZeroEstimate() {
        PaginatedList<Integer, String, Integer, Comparator<Integer>> multiples = range(1, 12).filter(
                (item, divisor) -> item % divisor == 0,
                divisor -> ALL,
                (filter, orderBy, limit) -> 0
        );

        QueryResult<Integer, String> first = multiples.next(multiples.getFirstCursor(), 5, ASC, 2, LimitPrecision.EXACT).join();
        QueryResult<Integer, String> rest = multiples.next(first.cursor(), 5, ASC, 2, LimitPrecision.EXACT).join();

        assertThat(first.items()).containsExactly(5, 10);
        assertThat(first.isLast()).isFalse();
        assertThat(rest.items()).isEmpty();
        assertThat(rest.isLast()).isTrue();
    }

    @Test
    @DisplayName("Should pass an extended filter on to the source and apply the extra condition")
    void shouldApplyAddedFilter() {
        PaginatedList<Integer, String, RangeFilter, Comparator<Integer>> ranged = range(1, 10).addFilter(
                (item, filter) -> item >= filter.min(),
                FetchSizeEstimator.scaled(2)
        );

        QueryResult<Integer, String> page = ranged.next(ranged.getFirstCursor(), new RangeFilter(3, 7), ASC, 10, LimitPrecision.EXACT).join();

        assertThat(page.items()).containsExactly(3, 4, 5, 6, 7);
        assertThat(page.isFirst()).isTrue();
        assertThat(page.isLast()).isTrue();
    }

    @Test
    @DisplayName("Should scale the fetch size estimate and reject non-positive factors")
    void shouldScaleEstimate() {
        assertThat(FetchSizeEstimator.<Integer, Comparator<Integer>>scaled(2.5).estimate(3, ASC, 4)).isEqualTo(10);
        assertThat(FetchSizeEstimator.<Integer, Comparator<Integer>>sameAsLimit().estimate(3, ASC, 4)).isEqualTo(4);
        assertThatThrownBy(() -> FetchSizeEstimator.scaled(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // FLAT MAP
    // =========================================================================

    @Test
    @DisplayName("Should expand each source item into several items")
    void shouldExpandItems() {
        // Given: every n becomes 10n and 10n + 1
        FlatMapOptions<Integer, String, Predicate<Integer>, Comparator<Integer>,
                Integer, String, Predicate<Integer>, Comparator<Integer>> options = new FlatMapOptions<>(
                (entry, filter, orderBy) -> List.of(
                        new PageEntry<>(entry.item() * 10, entry.itemCursor()),
                        new PageEntry<>(entry.item() * 10 + 1, entry.itemCursor())
                ),
                (orderBy, a, b) -> orderBy.compare(a, b),
                Function.identity(),
                Function.identity(),
                Function.identity(),
                Function.identity(),
                (filter, orderBy, limit) -> limit / 2
        );
        PaginatedList<Integer, String, Predicate<Integer>, Comparator<Integer>> expanded = range(1, 4).flatMap(options);

        // When
        QueryResult<Integer, String> first = expanded.next(expanded.getFirstCursor(), ALL, ASC, 4, LimitPrecision.EXACT).join();
        QueryResult<Integer, String> second = expanded.next(first.cursor(), ALL, ASC, 4, LimitPrecision.EXACT).join();

        // Then
        assertThat(first.items()).containsExactly(10, 11, 20, 21);
        assertThat(first.isLast()).isFalse();
        assertThat(second.items()).containsExactly(30, 31, 40, 41);
        assertThat(second.isLast()).isTrue();
    }

    @Test
    @DisplayName("Should reject options with missing functions")
    void shouldRejectIncompleteOptions() {
        assertThatThrownBy(() -> new FlatMapOptions<Integer, String, Predicate<Integer>, Comparator<Integer>,
                Integer, String, Predicate<Integer>, Comparator<Integer>>(
                null,
                (orderBy, a, b) -> orderBy.compare(a, b),
                Function.identity(),
                Function.identity(),
                Function.identity(),
                Function.identity(),
                FetchSizeEstimator.sameAsLimit()
        )).isInstanceOf(NullPointerException.class)
                .hasMessageContaining("itemMapper");
    }

    /**
     * Filter understood by the source for the upper bound, with a lower bound only the derived list checks.
     */
    record RangeFilter(int min, int max) implements Predicate<Integer> {
        @Override
        public boolean test(Integer item) {
            return item <= max;
        }
    }
}
