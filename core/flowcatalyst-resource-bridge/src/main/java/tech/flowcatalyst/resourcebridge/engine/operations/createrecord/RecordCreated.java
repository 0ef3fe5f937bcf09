package tech.flowcatalyst.resourcebridge.engine.operations.createrecord;

import java.util.Map;

/**
 * Result of a successful create.
 *
 * @param success always true
 * @param id      the store-assigned primary key
 * @param object  the created record as serialized after insert
 */
public record RecordCreated(
    boolean success,
    Object id,
    Map<String, Object> object
) {

    public static RecordCreated of(Object id, Map<String, Object> object) {
        return new RecordCreated(true, id, object);
    }
}
