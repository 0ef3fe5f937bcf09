package tech.flowcatalyst.resourcebridge.engine.operations.listrecords;

import java.util.List;
import java.util.Map;

/**
 * Command to list records of a resource.
 *
 * @param filters "field" or "field__lookup" keys to values
 * @param search  free-text term, or null
 * @param orderBy ordering terms, "-field" for descending
 * @param limit   page size, or null for the configured default
 * @param offset  number of records to skip
 */
public record ListRecordsCommand(
    Map<String, Object> filters,
    String search,
    List<String> orderBy,
    Integer limit,
    int offset
) {

    public static ListRecordsCommand all() {
        return new ListRecordsCommand(Map.of(), null, List.of(), null, 0);
    }
}
