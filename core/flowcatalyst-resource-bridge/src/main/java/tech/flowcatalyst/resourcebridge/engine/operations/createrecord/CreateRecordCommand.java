package tech.flowcatalyst.resourcebridge.engine.operations.createrecord;

import java.util.Map;

/**
 * Command to create a record.
 *
 * @param data field values keyed by field name; foreign keys may use the "_id" alias
 */
public record CreateRecordCommand(Map<String, Object> data) {}
