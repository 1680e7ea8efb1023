package com.example.paginated.streaming.spliterator;

import com.example.paginated.cursor.MergedCursor;
import com.example.paginated.list.PaginatedList;
import com.example.paginated.model.Direction;
import com.example.paginated.model.TraversalOptions;
import com.example.paginated.source.ArrayPaginatedList;
import com.example.paginated.source.ChunkedPaginatedList;
import com.example.paginated.source.FailingPaginatedList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Spliterator;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PaginatedSpliterator.
 *
 * <h2>What is checked</h2>
 * <ul>
 *   <li>The stream yields every item once, in traversal order</li>
 *   <li>Short-circuiting operations stop fetching pages</li>
 *   <li>Fetch failures surface as exceptions from the terminal operation</li>
 * </ul>
 */
class PaginatedSpliteratorTest {

    private static final Predicate<Integer> ALL = x -> true;
    private static final Comparator<Integer> ASC = Comparator.naturalOrder();

    private static List<Integer> range(int fromInclusive, int toInclusive) {
        return IntStream.rangeClosed(fromInclusive, toInclusive).boxed().collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should stream all items of a list in order")
    void shouldStreamAllItems() {
        ChunkedPaginatedList list = new ChunkedPaginatedList(range(1, 50), 7);

        List<Integer> items = PaginatedSpliterator.stream(list, TraversalOptions.defaults(ALL, ASC).withPageSize(10))
                .collect(Collectors.toList());

        assertThat(items).containsExactlyElementsOf(range(1, 50));
    }

    @Test
    @DisplayName("Should stream more than ten thousand items over trimmed pages")
    void shouldStreamManyItems() {
        // Chunks of 7 never line up with pages of 50, so every page is trimmed
        ChunkedPaginatedList list = new ChunkedPaginatedList(range(1, 12_000), 7);

        List<Integer> items = PaginatedSpliterator.stream(list, TraversalOptions.defaults(ALL, ASC).withPageSize(50))
                .collect(Collectors.toList());

        assertThat(items).hasSize(12_000).isEqualTo(range(1, 12_000));
    }

    @Test
    @DisplayName("Should stream a merged list backwards")
    void shouldStreamMergedListBackwards() {
        PaginatedList<Integer, MergedCursor, Predicate<Integer>, Comparator<Integer>> merged = PaginatedList.merge(
                new ArrayPaginatedList<>(List.of(1, 4, 7, 10)),
                new ArrayPaginatedList<>(List.of(2, 5, 8)),
                new ArrayPaginatedList<>(List.of(3, 6, 9))
        );

        List<Integer> items = PaginatedSpliterator.stream(
                merged,
                TraversalOptions.defaults(ALL, ASC).withPageSize(4).withDirection(Direction.PREV)
        ).collect(Collectors.toList());

        assertThat(items).containsExactly(10, 9, 8, 7, 6, 5, 4, 3, 2, 1);
    }

    @Test
    @DisplayName("Should stop fetching once a short-circuiting operation is satisfied")
    void shouldStopFetchingWhenShortCircuited() {
        ChunkedPaginatedList list = new ChunkedPaginatedList(range(1, 100), 10);

        List<Integer> firstThree = PaginatedSpliterator.stream(list, TraversalOptions.defaults(ALL, ASC).withPageSize(10))
                .limit(3)
                .collect(Collectors.toList());

        assertThat(firstThree).containsExactly(1, 2, 3);
        assertThat(list.getFetchCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report ordered items and refuse to split")
    void shouldNotSplit() {
        PaginatedSpliterator<Integer, String, Predicate<Integer>, Comparator<Integer>> spliterator =
                new PaginatedSpliterator<>(new ArrayPaginatedList<>(range(1, 3)), TraversalOptions.defaults(ALL, ASC));

        assertThat(spliterator.trySplit()).isNull();
        assertThat(spliterator.hasCharacteristics(Spliterator.ORDERED)).isTrue();
    }

    @Test
    @DisplayName("Should propagate fetch failures from the terminal operation")
    void shouldPropagateFailures() {
        IllegalStateException failure = new IllegalStateException("source unavailable");

        assertThatThrownBy(() -> PaginatedSpliterator.stream(new FailingPaginatedList(failure), TraversalOptions.defaults(ALL, ASC))
                .collect(Collectors.toList()))
                .isInstanceOf(RuntimeException.class)
                .hasMessage("Failed to fetch page with cursor: first")
                .hasCause(failure);
    }
}
