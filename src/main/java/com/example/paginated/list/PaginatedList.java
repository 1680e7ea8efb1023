package com.example.paginated.list;

import com.example.paginated.cursor.MergedCursor;
import com.example.paginated.model.Direction;
import com.example.paginated.model.LimitPrecision;
import com.example.paginated.model.PageEntry;
import com.example.paginated.model.QueryOptions;
import com.example.paginated.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * An ordered, filterable list of items that is walked page by page with opaque cursors.
 *
 * <p>Subclasses implement four primitives: the two sentinel cursors, the comparator,
 * and a single directional fetch ({@link #doNextOrPrev}) that is always called with
 * {@link LimitPrecision#APPROXIMATE} precision. This class turns those primitives into
 * {@link #next}/{@link #prev} calls that honour every {@link LimitPrecision}, verify that
 * each page is sorted, and trim over-fetched entries.
 *
 * <p>Combinators ({@link #map}, {@link #filter}, {@link #addFilter}, {@link #flatMap},
 * {@link #merge}, {@link #empty}) return new lists that delegate to existing ones, so
 * the traversal loop lives only here.
 *
 * <p>Example usage:
 * <pre>{@code
 * PaginatedList<Integer, String, Predicate<Integer>, Comparator<Integer>> list =
 *     new ArrayPaginatedList<>(List.of(1, 2, 3, 4, 5));
 *
 * QueryResult<Integer, String> page = list.next(
 *     list.getFirstCursor(), x -> true, Comparator.naturalOrder(), 2, LimitPrecision.EXACT
 * ).join();
 *
 * // page.items() == [1, 2]; continue from page.cursor()
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Lists are immutable once constructed and hold no traversal
 * state, so one instance can serve any number of concurrent callers. A traversal is
 * just the cursor the caller passes back in.
 *
 * @param <T> the item type
 * @param <C> the cursor type
 * @param <F> the filter type
 * @param <O> the order-by type
 */
public abstract class PaginatedList<T, C, F, O> {

    private static final Logger log = LoggerFactory.getLogger(PaginatedList.class);

    // =========================================================================
    // PRIMITIVES
    // =========================================================================

    /**
     * Returns the sentinel positioned before the first item, whatever the filter and ordering.
     */
    protected abstract C doGetFirstCursor();

    /**
     * Returns the sentinel positioned after the last item, whatever the filter and ordering.
     */
    protected abstract C doGetLastCursor();

    /**
     * Compares two items consistently with the order {@link #doNextOrPrev} returns them in.
     */
    protected abstract int doCompare(O orderBy, T a, T b);

    /**
     * Fetches roughly {@code options.limit()} items strictly after ({@link Direction#NEXT})
     * or strictly before ({@link Direction#PREV}) {@code options.cursor()}.
     *
     * <p>The precision is always {@link LimitPrecision#APPROXIMATE}: an implementation may
     * return more or fewer items than asked for, but must report accurate
     * {@code isFirst}/{@code isLast} flags and must make progress.
     */
    protected abstract CompletableFuture<QueryResult<T, C>> doNextOrPrev(
            Direction direction,
            QueryOptions<C, F, O> options
    );

    // =========================================================================
    // PUBLIC API
    // =========================================================================

    /**
     * Returns the cursor positioned before the first item; {@code next} from it starts at the top.
     *
     * @return the first-position sentinel, valid for any filter and ordering
     */
    public C getFirstCursor() {
        return doGetFirstCursor();
    }

    /**
     * Returns the cursor positioned after the last item; {@code prev} from it starts at the bottom.
     *
     * @return the last-position sentinel, valid for any filter and ordering
     */
    public C getLastCursor() {
        return doGetLastCursor();
    }

    /**
     * Compares two items the way pages of this list are ordered.
     *
     * @param orderBy the ordering to compare under
     * @param a the first item
     * @param b the second item
     * @return a negative number, zero or a positive number as {@code a} sorts before,
     *         together with or after {@code b}
     */
    public int compare(O orderBy, T a, T b) {
        return doCompare(orderBy, a, b);
    }

    /**
     * Returns the page following {@code options.cursor()}.
     *
     * @param options the cursor, filter, ordering, limit and precision of the query
     * @return a future holding the page
     */
    public CompletableFuture<QueryResult<T, C>> next(QueryOptions<C, F, O> options) {
        return nextOrPrev(Direction.NEXT, options);
    }

    /**
     * Returns the page following {@code after}.
     *
     * @param after the cursor to start after, e.g. {@link #getFirstCursor()} or a returned cursor
     * @param filter the filter passed to the underlying source
     * @param orderBy the ordering passed to the underlying source
     * @param limit the number of items asked for
     * @param limitPrecision how strictly {@code limit} is honoured
     * @return a future holding the page
     */
    public CompletableFuture<QueryResult<T, C>> next(C after, F filter, O orderBy, int limit, LimitPrecision limitPrecision) {
        return next(new QueryOptions<>(after, filter, orderBy, limit, limitPrecision));
    }

    /**
     * Returns the page preceding {@code options.cursor()}.
     *
     * @param options the cursor, filter, ordering, limit and precision of the query
     * @return a future holding the page, its entries in ascending order
     */
    public CompletableFuture<QueryResult<T, C>> prev(QueryOptions<C, F, O> options) {
        return nextOrPrev(Direction.PREV, options);
    }

    /**
     * Returns the page preceding {@code before}.
     *
     * @param before the cursor to end before, e.g. {@link #getLastCursor()} or a returned cursor
     * @param filter the filter passed to the underlying source
     * @param orderBy the ordering passed to the underlying source
     * @param limit the number of items asked for
     * @param limitPrecision how strictly {@code limit} is honoured
     * @return a future holding the page, its entries in ascending order
     */
    public CompletableFuture<QueryResult<T, C>> prev(C before, F filter, O orderBy, int limit, LimitPrecision limitPrecision) {
        return prev(new QueryOptions<>(before, filter, orderBy, limit, limitPrecision));
    }

    /**
     * Fetches one page in the given direction.
     *
     * <p>Calls {@link #doNextOrPrev} until the limit is satisfied or the boundary in the
     * traversal direction is reached. {@link LimitPrecision#AT_MOST} and
     * {@link LimitPrecision#APPROXIMATE} stop after a single fetch. The accumulated
     * entries are then checked for sortedness and, for {@link LimitPrecision#EXACT} and
     * {@link LimitPrecision#AT_MOST}, trimmed to the limit.
     *
     * <p>The returned future fails with {@link PaginationConsistencyException} if the
     * underlying source returned unsorted entries or stopped making progress, and with
     * whatever the underlying fetch failed with otherwise.
     *
     * @param direction {@link Direction#NEXT} to read after the cursor, {@link Direction#PREV} to read before it
     * @param options the query
     * @return a future holding the page
     */
    public CompletableFuture<QueryResult<T, C>> nextOrPrev(Direction direction, QueryOptions<C, F, O> options) {
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Accumulation<T, C> accumulation = new Accumulation<>(options.cursor(), options.limit());
        return accumulate(direction, options, accumulation)
                .thenApply(acc -> complete(direction, options, acc));
    }

    // =========================================================================
    // COMBINATORS
    // =========================================================================

    /**
     * Returns a list whose entries are produced by mapping each entry of this list to
     * zero, one or many new entries. {@link #map} and {@link #filter} are special cases.
     *
     * @param options the entry mapping and the conversions back to this list's types
     * @return the derived list
     */
    public <T2, C2, F2, O2> PaginatedList<T2, C2, F2, O2> flatMap(
            FlatMapOptions<T, C, F, O, T2, C2, F2, O2> options
    ) {
        return new FlatMapPaginatedList<>(this, options);
    }

    /**
     * Returns a list of mapped items that shares this list's cursors.
     *
     * <p>{@code oldItemFromNewItem} must invert {@code itemMapper} closely enough that the
     * mapped list sorts the same way as this one; the mapped list compares items by
     * mapping them back and delegating to this list's comparator.
     *
     * @param itemMapper maps an item of this list to an item of the new list
     * @param oldItemFromNewItem maps a new item back for comparison
     * @param oldFilterFromNewFilter the filter to pass on to this list
     * @param oldOrderByFromNewOrderBy the ordering to pass on to this list
     * @return the mapped list
     */
    public <T2, F2, O2> PaginatedList<T2, C, F2, O2> map(
            Function<T, T2> itemMapper,
            Function<T2, T> oldItemFromNewItem,
            Function<F2, F> oldFilterFromNewFilter,
            Function<O2, O> oldOrderByFromNewOrderBy
    ) {
        FlatMapOptions<T, C, F, O, T2, C, F2, O2> options = new FlatMapOptions<>(
                (entry, filter, orderBy) -> List.<PageEntry<T2, C>>of(
                        new PageEntry<>(itemMapper.apply(entry.item()), entry.itemCursor())
                ),
                (orderBy, a, b) -> compare(
                        oldOrderByFromNewOrderBy.apply(orderBy),
                        oldItemFromNewItem.apply(a),
                        oldItemFromNewItem.apply(b)
                ),
                Function.identity(),
                Function.identity(),
                oldFilterFromNewFilter,
                oldOrderByFromNewOrderBy,
                FetchSizeEstimator.sameAsLimit()
        );
        return flatMap(options);
    }

    /**
     * Returns a list that keeps only the items matching {@code predicate} under the new filter.
     *
     * @param predicate decides whether an item belongs to the list for a given filter
     * @param oldFilterFromNewFilter the filter to pass on to this list
     * @param estimateItemsToFetch how many items to request from this list per fetch
     * @return the filtered list
     */
    public <F2> PaginatedList<T, C, F2, O> filter(
            BiPredicate<T, F2> predicate,
            Function<F2, F> oldFilterFromNewFilter,
            FetchSizeEstimator<F2, O> estimateItemsToFetch
    ) {
        FlatMapOptions<T, C, F, O, T, C, F2, O> options = new FlatMapOptions<>(
                (entry, filter, orderBy) -> predicate.test(entry.item(), filter)
                        ? List.<PageEntry<T, C>>of(entry)
                        : List.<PageEntry<T, C>>of(),
                this::compare,
                Function.identity(),
                Function.identity(),
                oldFilterFromNewFilter,
                Function.identity(),
                estimateItemsToFetch
        );
        return flatMap(options);
    }

    /**
     * Like {@link #filter}, for a filter type that extends this list's filter: the
     * extended filter is passed on to this list unchanged and additionally checked
     * by {@code predicate}.
     *
     * @return the filtered list
     */
    public <F2 extends F> PaginatedList<T, C, F2, O> addFilter(
            BiPredicate<T, F2> predicate,
            FetchSizeEstimator<F2, O> estimateItemsToFetch
    ) {
        return filter(predicate, extended -> extended, estimateItemsToFetch);
    }

    /**
     * Merges lists that share the same item, filter and ordering types into one ordered list.
     *
     * <p>The merged cursor is the tuple of the constituent cursors and is only meaningful
     * to the returned list. All constituents must order items identically; a disagreement
     * fails the query with {@link PaginationConsistencyException}.
     *
     * @param lists the lists to merge, at least one
     * @return the merged list
     */
    @SafeVarargs
    public static <T, F, O> PaginatedList<T, MergedCursor, F, O> merge(PaginatedList<T, ?, F, O>... lists) {
        return merge(Arrays.asList(lists));
    }

    /**
     * Same as {@link #merge(PaginatedList[])} for a list of lists.
     */
    public static <T, F, O> PaginatedList<T, MergedCursor, F, O> merge(
            List<? extends PaginatedList<T, ?, F, O>> lists
    ) {
        return new MergePaginatedList<>(lists);
    }

    /**
     * Returns a list without items.
     */
    public static <T, F, O> PaginatedList<T, String, F, O> empty() {
        return new EmptyPaginatedList<>();
    }

    // =========================================================================
    // TRAVERSAL LOOP
    // =========================================================================

    /**
     * Runs fetches until {@link #recordIteration} reports the call is satisfied.
     *
     * <p>Fetches that are already complete are consumed in this loop; only a fetch that is
     * still pending hands the rest of the loop to its completion, so the stack stays flat
     * however many fetches a call needs.
     */
    private CompletableFuture<Accumulation<T, C>> accumulate(
            Direction direction,
            QueryOptions<C, F, O> options,
            Accumulation<T, C> acc
    ) {
        while (true) {
            C iterationCursor = acc.cursor;
            QueryOptions<C, F, O> iterationOptions = new QueryOptions<>(
                    iterationCursor,
                    options.filter(),
                    options.orderBy(),
                    Math.max(acc.remaining, 0),
                    LimitPrecision.APPROXIMATE
            );

            CompletableFuture<QueryResult<T, C>> fetch = fetchIteration(direction, iterationOptions);
            if (!fetch.isDone()) {
                return fetch.thenCompose(iteration ->
                        recordIteration(direction, options, iterationOptions, acc, iteration)
                                ? CompletableFuture.completedFuture(acc)
                                : accumulate(direction, options, acc));
            }
            if (fetch.isCompletedExceptionally()) {
                return fetch.thenApply(ignored -> acc);
            }

            try {
                if (recordIteration(direction, options, iterationOptions, acc, fetch.join())) {
                    return CompletableFuture.completedFuture(acc);
                }
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }

    /**
     * Adds one fetch to the accumulation and returns {@code true} once no further fetch is needed.
     */
    private boolean recordIteration(
            Direction direction,
            QueryOptions<C, F, O> options,
            QueryOptions<C, F, O> iterationOptions,
            Accumulation<T, C> acc,
            QueryResult<T, C> iteration
    ) {
        acc.add(direction, iteration);
        log.trace("{} fetch #{} returned {} entries, {} remaining",
                direction, acc.iterations, iteration.size(), acc.remaining);

        if (options.limitPrecision().isSingleFetch()
                || acc.remaining <= 0
                || acc.reachedBoundary(direction)) {
            return true;
        }
        if (iteration.isEmpty() && Objects.equals(iteration.cursor(), iterationOptions.cursor())) {
            throw new PaginationConsistencyException(
                    "Paginated list made no progress; the underlying fetch returned no items and the same cursor",
                    diagnostics("direction", direction, "options", iterationOptions, "iteration", iteration)
            );
        }
        return false;
    }

    private CompletableFuture<QueryResult<T, C>> fetchIteration(Direction direction, QueryOptions<C, F, O> options) {
        try {
            return Objects.requireNonNull(doNextOrPrev(direction, options), "doNextOrPrev returned null");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private QueryResult<T, C> complete(Direction direction, QueryOptions<C, F, O> options, Accumulation<T, C> acc) {
        List<PageEntry<T, C>> entries = acc.entries();
        assertSorted(direction, options, entries);

        boolean isFirst = acc.includesFirst;
        boolean isLast = acc.includesLast;
        C cursor = acc.cursor;
        int limit = options.limit();

        if (options.limitPrecision().trimsExcess() && entries.size() > limit) {
            if (direction == Direction.NEXT) {
                entries = entries.subList(0, limit);
                isLast = false;
                cursor = limit > 0 ? entries.get(limit - 1).itemCursor() : options.cursor();
            } else {
                entries = entries.subList(entries.size() - limit, entries.size());
                isFirst = false;
                cursor = limit > 0 ? entries.get(0).itemCursor() : options.cursor();
            }
        }

        log.debug("{} returned {} of {} requested entries after {} fetches (isFirst={}, isLast={})",
                direction, entries.size(), limit, acc.iterations, isFirst, isLast);
        return new QueryResult<>(entries, isFirst, isLast, cursor);
    }

    private void assertSorted(Direction direction, QueryOptions<C, F, O> options, List<PageEntry<T, C>> entries) {
        for (int i = 1; i < entries.size(); i++) {
            if (compare(options.orderBy(), entries.get(i).item(), entries.get(i - 1).item()) < 0) {
                throw new PaginationConsistencyException(
                        "Paginated list result is not sorted; the underlying source broke its ordering contract",
                        diagnostics("index", i, "direction", direction, "options", options, "entries", entries)
                );
            }
        }
    }

    static Map<String, Object> diagnostics(Object... keysAndValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            context.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return context;
    }

    /**
     * Entries and flags collected over the fetches of one call.
     */
    private static final class Accumulation<T, C> {
        private final Deque<List<PageEntry<T, C>>> chunks = new ArrayDeque<>();
        private int size;
        private int remaining;
        private int iterations;
        private boolean includesFirst;
        private boolean includesLast;
        private C cursor;

        Accumulation(C cursor, int limit) {
            this.cursor = cursor;
            this.remaining = limit;
        }

        void add(Direction direction, QueryResult<T, C> iteration) {
            if (direction == Direction.NEXT) {
                chunks.addLast(iteration.entries());
            } else {
                chunks.addFirst(iteration.entries());
            }
            size += iteration.size();
            remaining -= iteration.size();
            includesFirst |= iteration.isFirst();
            includesLast |= iteration.isLast();
            cursor = iteration.cursor();
            iterations++;
        }

        boolean reachedBoundary(Direction direction) {
            return direction.reachedBoundary(includesFirst, includesLast);
        }

        List<PageEntry<T, C>> entries() {
            List<PageEntry<T, C>> entries = new ArrayList<>(size);
            chunks.forEach(entries::addAll);
            return entries;
        }
    }
}
