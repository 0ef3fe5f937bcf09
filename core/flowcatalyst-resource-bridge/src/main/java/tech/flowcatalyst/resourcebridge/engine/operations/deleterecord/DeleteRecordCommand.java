package tech.flowcatalyst.resourcebridge.engine.operations.deleterecord;

/**
 * Command to delete one record.
 *
 * @param id primary key as supplied by the caller
 */
public record DeleteRecordCommand(Object id) {}
