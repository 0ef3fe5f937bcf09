package tech.flowcatalyst.resourcebridge.resource;

import tech.flowcatalyst.resourcebridge.common.ExecutionContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A named side-effecting operation over a selection of records.
 *
 * <p>Actions run inside the caller's unit of work, so anything they change
 * through a {@link ResourceStore} commits or rolls back with the action.
 */
public interface RecordAction {

    /**
     * Action name used in commands (e.g., "publish").
     */
    String name();

    /**
     * Short human-readable description.
     */
    String description();

    /**
     * Apply the action to the selected records.
     *
     * @param records the matched records
     * @param context execution context of the calling command
     * @return optional textual result reported back to the caller
     * @throws Exception any failure rolls the action back
     */
    Optional<String> apply(List<Map<String, Object>> records, ExecutionContext context) throws Exception;
}
