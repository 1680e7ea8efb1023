package com.example.paginated.list;

import com.example.paginated.cursor.MergedCursor;
import com.example.paginated.model.Direction;
import com.example.paginated.model.LimitPrecision;
import com.example.paginated.model.PageEntry;
import com.example.paginated.model.QueryOptions;
import com.example.paginated.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * K-way merge of lists that share item, filter and ordering types, see {@link PaginatedList#merge}.
 *
 * <p>Each fetch queries every constituent concurrently with {@link LimitPrecision#AT_LEAST}
 * precision and merges the answers with a stable sort. Entries past the smallest trailing
 * item of any constituent that still has more items (largest leading item when walking
 * backwards) are dropped: an item not fetched yet could sort before them. Those entries are
 * fetched again by the following call.
 *
 * <p>Every emitted entry carries the full tuple of constituent cursors as of that entry,
 * so trimming a merged page at any entry yields a valid continuation cursor.
 */
final class MergePaginatedList<T, F, O> extends PaginatedList<T, MergedCursor, F, O> {

    private static final Logger log = LoggerFactory.getLogger(MergePaginatedList.class);

    private final List<PaginatedList<T, ?, F, O>> lists;
    // Empty lists hold no items, so their constant comparator takes no part in the agreement check.
    private final List<PaginatedList<T, ?, F, O>> comparingLists;

    MergePaginatedList(List<? extends PaginatedList<T, ?, F, O>> lists) {
        this.lists = List.copyOf(lists);
        this.comparingLists = this.lists.stream()
                .filter(list -> !(list instanceof EmptyPaginatedList))
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    protected MergedCursor doGetFirstCursor() {
        return new MergedCursor(lists.stream().<Object>map(PaginatedList::getFirstCursor).collect(Collectors.toList()));
    }

    @Override
    protected MergedCursor doGetLastCursor() {
        return new MergedCursor(lists.stream().<Object>map(PaginatedList::getLastCursor).collect(Collectors.toList()));
    }

    @Override
    protected int doCompare(O orderBy, T a, T b) {
        if (comparingLists.isEmpty()) {
            return 0;
        }
        int[] results = new int[comparingLists.size()];
        for (int i = 0; i < results.length; i++) {
            results[i] = comparingLists.get(i).compare(orderBy, a, b);
        }
        int expected = Integer.signum(results[0]);
        for (int result : results) {
            if (Integer.signum(result) != expected) {
                throw new PaginationConsistencyException(
                        "Merged lists have different compare results; make sure they use the same ordering",
                        diagnostics("orderBy", orderBy, "a", a, "b", b, "results", Arrays.toString(results))
                );
            }
        }
        return results[0];
    }

    @Override
    protected CompletableFuture<QueryResult<T, MergedCursor>> doNextOrPrev(
            Direction direction,
            QueryOptions<MergedCursor, F, O> options
    ) {
        MergedCursor cursor = options.cursor();
        if (cursor.size() != lists.size()) {
            throw new IllegalArgumentException(
                    "Merged cursor has " + cursor.size() + " positions but " + lists.size() + " lists are merged");
        }

        List<CompletableFuture<? extends QueryResult<T, ?>>> fetches = new ArrayList<>(lists.size());
        for (int i = 0; i < lists.size(); i++) {
            fetches.add(fetchConstituent(lists.get(i), direction, cursor.get(i), options));
        }

        return CompletableFuture.allOf(fetches.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> combine(
                        direction,
                        options,
                        fetches.stream().<QueryResult<T, ?>>map(CompletableFuture::join).collect(Collectors.toList())
                ));
    }

    /**
     * Queries one constituent with {@link LimitPrecision#AT_LEAST} from its own position.
     */
    private static <T, C, F, O> CompletableFuture<QueryResult<T, C>> fetchConstituent(
            PaginatedList<T, C, F, O> list,
            Direction direction,
            Object position,
            QueryOptions<MergedCursor, F, O> options
    ) {
        // Position i of a merged cursor was produced by constituent i.
        @SuppressWarnings("unchecked")
        C cursor = (C) position;
        return list.nextOrPrev(direction, new QueryOptions<>(
                cursor,
                options.filter(),
                options.orderBy(),
                options.limit(),
                LimitPrecision.AT_LEAST
        ));
    }

    private QueryResult<T, MergedCursor> combine(
            Direction direction,
            QueryOptions<MergedCursor, F, O> options,
            List<QueryResult<T, ?>> results
    ) {
        O orderBy = options.orderBy();

        List<Candidate<T>> candidates = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            for (PageEntry<T, ?> entry : results.get(i).entries()) {
                candidates.add(new Candidate<>(i, entry));
            }
        }
        candidates.sort((a, b) -> compare(orderBy, a.entry().item(), b.entry().item()));

        List<Candidate<T>> emitted = emittable(direction, orderBy, results, candidates);

        Object[] positions = options.cursor().cursors().toArray();
        int[] consumed = new int[results.size()];
        List<PageEntry<T, MergedCursor>> entries = new ArrayList<>(emitted.size());
        if (direction == Direction.NEXT) {
            for (Candidate<T> candidate : emitted) {
                entries.add(advance(positions, consumed, candidate));
            }
        } else {
            for (int i = emitted.size() - 1; i >= 0; i--) {
                entries.add(advance(positions, consumed, emitted.get(i)));
            }
            Collections.reverse(entries);
        }

        boolean allConsumed = emitted.size() == candidates.size();
        boolean allFirst = results.stream().allMatch(QueryResult::isFirst);
        boolean allLast = results.stream().allMatch(QueryResult::isLast);
        for (int i = 0; i < results.size(); i++) {
            if (consumed[i] == results.get(i).size()) {
                positions[i] = results.get(i).cursor();
            }
        }

        if (!allConsumed) {
            log.trace("{} merge deferred {} of {} fetched entries", direction, candidates.size() - emitted.size(),
                    candidates.size());
        }
        return new QueryResult<>(
                entries,
                allFirst && (direction == Direction.NEXT || allConsumed),
                allLast && (direction == Direction.PREV || allConsumed),
                new MergedCursor(Arrays.asList(positions))
        );
    }

    /**
     * Returns the prefix (suffix when walking backwards) of the sorted candidates that no
     * unfetched item of any constituent can sort into.
     */
    private List<Candidate<T>> emittable(
            Direction direction,
            O orderBy,
            List<QueryResult<T, ?>> results,
            List<Candidate<T>> candidates
    ) {
        T cutoff = null;
        boolean hasCutoff = false;
        for (QueryResult<T, ?> result : results) {
            if (result.reachedBoundary(direction)) {
                continue;
            }
            if (result.isEmpty()) {
                // Nothing is known about where this constituent continues.
                return List.of();
            }
            List<? extends PageEntry<T, ?>> entries = result.entries();
            T edge = direction == Direction.NEXT
                    ? entries.get(entries.size() - 1).item()
                    : entries.get(0).item();
            if (!hasCutoff || (direction == Direction.NEXT
                    ? compare(orderBy, edge, cutoff) < 0
                    : compare(orderBy, edge, cutoff) > 0)) {
                cutoff = edge;
                hasCutoff = true;
            }
        }
        if (!hasCutoff) {
            return candidates;
        }

        List<Candidate<T>> emitted = new ArrayList<>(candidates.size());
        for (Candidate<T> candidate : candidates) {
            int comparison = compare(orderBy, candidate.entry().item(), cutoff);
            if (direction == Direction.NEXT ? comparison <= 0 : comparison >= 0) {
                emitted.add(candidate);
            }
        }
        return emitted;
    }

    private static <T> PageEntry<T, MergedCursor> advance(Object[] positions, int[] consumed, Candidate<T> candidate) {
        positions[candidate.listIndex()] = candidate.entry().itemCursor();
        consumed[candidate.listIndex()]++;
        return new PageEntry<>(candidate.entry().item(), new MergedCursor(Arrays.asList(positions)));
    }

    private record Candidate<T>(int listIndex, PageEntry<T, ?> entry) {
    }
}
