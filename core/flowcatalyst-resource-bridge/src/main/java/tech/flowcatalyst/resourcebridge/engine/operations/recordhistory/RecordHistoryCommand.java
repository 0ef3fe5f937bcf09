package tech.flowcatalyst.resourcebridge.engine.operations.recordhistory;

/**
 * @param id    primary key as supplied by the caller
 * @param limit maximum entries, or null for the configured default
 */
public record RecordHistoryCommand(Object id, Integer limit) {}
