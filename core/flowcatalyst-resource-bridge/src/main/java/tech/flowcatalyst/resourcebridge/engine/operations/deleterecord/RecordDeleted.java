package tech.flowcatalyst.resourcebridge.engine.operations.deleterecord;

/**
 * Result of a successful delete.
 */
public record RecordDeleted(boolean success, String message) {}
