package tech.flowcatalyst.resourcebridge.engine.operations.getrecord;

/**
 * Command to fetch one record.
 *
 * @param id             primary key as supplied by the caller
 * @param includeInlines add child records under "_inlines"
 * @param includeRelated add relation previews under "_related"
 */
public record GetRecordCommand(
    Object id,
    boolean includeInlines,
    boolean includeRelated
) {

    public static GetRecordCommand of(Object id) {
        return new GetRecordCommand(id, false, false);
    }
}
