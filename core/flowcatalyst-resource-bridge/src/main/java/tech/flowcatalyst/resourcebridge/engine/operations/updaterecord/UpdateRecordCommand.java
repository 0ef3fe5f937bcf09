package tech.flowcatalyst.resourcebridge.engine.operations.updaterecord;

import java.util.List;
import java.util.Map;

/**
 * Command to update a record and, optionally, its children.
 *
 * @param id      primary key as supplied by the caller
 * @param data    fields to change
 * @param inlines child items keyed by child resource name; each item is
 *                {@code {id?, data, _delete?}}
 */
public record UpdateRecordCommand(
    Object id,
    Map<String, Object> data,
    Map<String, List<Map<String, Object>>> inlines
) {

    public UpdateRecordCommand {
        data = data != null ? data : Map.of();
        inlines = inlines != null ? inlines : Map.of();
    }

    public static UpdateRecordCommand of(Object id, Map<String, Object> data) {
        return new UpdateRecordCommand(id, data, Map.of());
    }
}
