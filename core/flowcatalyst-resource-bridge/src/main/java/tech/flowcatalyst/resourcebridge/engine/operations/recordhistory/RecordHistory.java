package tech.flowcatalyst.resourcebridge.engine.operations.recordhistory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Audit entries of one record, newest first.
 */
public record RecordHistory(
    String model,
    @JsonProperty("object_id") Object objectId,
    int count,
    List<Entry> history
) {

    /**
     * @param action created, changed or deleted
     * @param user   principal id recorded with the entry
     */
    public record Entry(
        String action,
        @JsonProperty("action_time") Instant actionTime,
        String user,
        @JsonProperty("change_message") String changeMessage
    ) {}
}
