package tech.flowcatalyst.resourcebridge.engine.operations.listrelated;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A page of records reachable through a to-many relation.
 */
public record RelatedRecords(
    String relation,
    String type,
    @JsonProperty("total_count") long totalCount,
    int count,
    List<Map<String, Object>> results
) {

    public static final String MANY = "many";
}
