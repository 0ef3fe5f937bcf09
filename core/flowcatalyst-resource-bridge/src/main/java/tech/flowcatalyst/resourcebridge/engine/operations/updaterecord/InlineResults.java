package tech.flowcatalyst.resourcebridge.engine.operations.updaterecord;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-child outcomes of an update with inlines.
 */
public record InlineResults(
    List<ChildChange> created,
    List<ChildChange> updated,
    List<ChildChange> deleted,
    List<ChildError> errors
) {

    public static InlineResults empty() {
        return new InlineResults(new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public boolean isEmpty() {
        return created.isEmpty() && updated.isEmpty() && deleted.isEmpty() && errors.isEmpty();
    }

    public record ChildChange(String model, Object id) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChildError(String model, Object id, String error, String code) {}
}
