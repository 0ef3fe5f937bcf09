package tech.flowcatalyst.resourcebridge.engine.operations.listrecords;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A page of serialized records.
 *
 * @param count      records in this page
 * @param totalCount records matching the filters and search, ignoring pagination
 * @param results    the serialized records
 */
public record RecordList(
    int count,
    @JsonProperty("total_count") long totalCount,
    List<Map<String, Object>> results
) {}
