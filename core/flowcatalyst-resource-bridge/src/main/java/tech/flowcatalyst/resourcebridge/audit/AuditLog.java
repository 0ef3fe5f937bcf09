package tech.flowcatalyst.resourcebridge.audit;

import java.time.Instant;

/**
 * Audit log entry documenting one mutation of one record.
 *
 * Entries are append-only. The object repr is captured at write time so a
 * deletion stays readable after the record is gone.
 */
public class AuditLog {

    public String id;

    /**
     * The resource name (e.g., "author").
     */
    public String resource;

    /**
     * The record's primary key, as a string.
     */
    public String objectId;

    /**
     * Display text of the record when the entry was written.
     */
    public String objectRepr;

    public AuditKind kind;

    /**
     * Description of the change (e.g., "Created via MCP: {...}").
     */
    public String changeMessage;

    /**
     * The principal who performed the operation.
     */
    public String principalId;

    /**
     * When the operation was performed.
     */
    public Instant performedAt = Instant.now();

    public AuditLog() {
    }
}
