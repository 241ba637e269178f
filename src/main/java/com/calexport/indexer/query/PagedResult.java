package com.calexport.indexer.query;

import java.util.List;

import lombok.Value;

/**
 * One page of a larger result. {@code total} counts every match, not just this page.
 */
@Value
public class PagedResult<T> {
    List<T> items;
    int total;
    int offset;
    int limit;

    public static <T> PagedResult<T> slice(List<T> all, int offset, int limit) {
        int from = Math.min(Math.max(0, offset), all.size());
        int to = limit > 0 ? Math.min(all.size(), from + limit) : all.size();
        return new PagedResult<>(List.copyOf(all.subList(from, to)), all.size(), offset, limit);
    }

    public boolean hasMore() {
        return offset + items.size() < total;
    }
}
