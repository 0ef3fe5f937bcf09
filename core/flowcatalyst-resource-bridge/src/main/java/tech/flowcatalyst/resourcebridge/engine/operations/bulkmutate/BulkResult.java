package tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a bulk command. Items appear in input order with their index.
 */
public record BulkResult(
    String operation,
    @JsonProperty("total_items") int totalItems,
    @JsonProperty("success_count") int successCount,
    @JsonProperty("error_count") int errorCount,
    Results results
) {

    public record Results(List<ItemSuccess> success, List<ItemError> errors) {}

    /**
     * A committed item. Exactly one of created, updated and deleted is set.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ItemSuccess(int index, Object id, Boolean created, Boolean updated, Boolean deleted) {

        static ItemSuccess of(BulkOperation operation, int index, Object id) {
            return switch (operation) {
                case CREATE -> new ItemSuccess(index, id, true, null, null);
                case UPDATE -> new ItemSuccess(index, id, null, true, null);
                case DELETE -> new ItemSuccess(index, id, null, null, true);
            };
        }
    }

    /**
     * A rolled-back item.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ItemError(
        int index,
        String error,
        String code,
        @JsonProperty("validation_errors") Object validationErrors
    ) {}
}
