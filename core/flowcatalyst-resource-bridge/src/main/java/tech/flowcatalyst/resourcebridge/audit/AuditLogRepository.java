package tech.flowcatalyst.resourcebridge.audit;

import java.util.List;

/**
 * Repository for audit log entries. Append-only: there is no update or delete.
 */
public interface AuditLogRepository {

    void persist(AuditLog log);

    /**
     * Entries for one record, newest first.
     */
    List<AuditLog> findByObject(String resource, String objectId, int limit);

    long countByObject(String resource, String objectId);
}
