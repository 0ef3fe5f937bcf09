package tech.flowcatalyst.resourcebridge.resource;

/**
 * One ordering term.
 */
public record SortField(String field, boolean descending) {

    /**
     * Parse "name" or "-name".
     */
    public static SortField parse(String term) {
        if (term.startsWith("-")) {
            return new SortField(term.substring(1), true);
        }
        return new SortField(term, false);
    }
}
