package tech.flowcatalyst.resourcebridge.resource;

import java.util.List;

/**
 * Filtered, searched, ordered and paginated query against a {@link ResourceStore}.
 *
 * <p>Filters combine with AND. The search term matches when any of the
 * search fields contains it, ignoring case.
 *
 * @param filters      conjunctive filters
 * @param searchTerm   free-text term, or null
 * @param searchFields fields the term is matched against
 * @param ordering     ordering terms, applied in order
 * @param offset       number of matching records to skip
 * @param limit        maximum records to return, or null for no limit
 */
public record ResourceQuery(
    List<FieldFilter> filters,
    String searchTerm,
    List<String> searchFields,
    List<SortField> ordering,
    int offset,
    Integer limit
) {

    public ResourceQuery {
        filters = filters != null ? List.copyOf(filters) : List.of();
        searchFields = searchFields != null ? List.copyOf(searchFields) : List.of();
        ordering = ordering != null ? List.copyOf(ordering) : List.of();
    }

    public static ResourceQuery all() {
        return new ResourceQuery(List.of(), null, List.of(), List.of(), 0, null);
    }

    public static ResourceQuery where(FieldFilter filter, List<SortField> ordering, int offset, Integer limit) {
        return new ResourceQuery(List.of(filter), null, List.of(), ordering, offset, limit);
    }

    public boolean hasSearch() {
        return searchTerm != null && !searchTerm.isEmpty() && !searchFields.isEmpty();
    }
}
