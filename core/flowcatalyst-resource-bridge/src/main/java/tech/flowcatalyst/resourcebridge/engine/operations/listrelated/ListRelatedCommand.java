package tech.flowcatalyst.resourcebridge.engine.operations.listrelated;

/**
 * @param id       primary key of the source record
 * @param relation relation name declared on the descriptor
 * @param limit    page size, or null for the configured default
 * @param offset   records to skip
 */
public record ListRelatedCommand(Object id, String relation, Integer limit, int offset) {}
