package com.example.paginated.list;

import com.example.paginated.model.PageEntry;

import java.util.List;

/**
 * Turns one entry of the source list into zero, one or many entries of the mapped list.
 *
 * <p>The returned entries must already be sorted under the mapped list's comparator
 * and must not sort before the entries produced for earlier source entries.
 *
 * @param <T> the source item type
 * @param <C> the source cursor type
 * @param <F2> the mapped filter type
 * @param <O2> the mapped order-by type
 * @param <T2> the mapped item type
 * @param <C2> the mapped cursor type
 */
@FunctionalInterface
public interface ItemMapper<T, C, F2, O2, T2, C2> {

    List<PageEntry<T2, C2>> map(PageEntry<T, C> entry, F2 filter, O2 orderBy);
}
