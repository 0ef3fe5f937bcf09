package tech.flowcatalyst.resourcebridge.common;

import java.util.List;
import java.util.function.Function;

/**
 * Offset-based page of results with a total count.
 *
 * <p>The total is counted against the same criteria as the items but
 * independently of offset and limit.
 *
 * @param items  the items in this page
 * @param total  total number of matching items across all pages
 * @param offset offset of the first item
 * @param limit  requested page size, or null when unbounded
 */
public record OffsetPage<T>(
    List<T> items,
    long total,
    int offset,
    Integer limit
) {

    public static <T> OffsetPage<T> empty(int offset, Integer limit) {
        return new OffsetPage<>(List.of(), 0, offset, limit);
    }

    public int count() {
        return items.size();
    }

    public boolean hasMore() {
        return offset + items.size() < total;
    }

    public <R> OffsetPage<R> map(Function<T, R> mapper) {
        return new OffsetPage<>(items.stream().map(mapper).toList(), total, offset, limit);
    }
}
