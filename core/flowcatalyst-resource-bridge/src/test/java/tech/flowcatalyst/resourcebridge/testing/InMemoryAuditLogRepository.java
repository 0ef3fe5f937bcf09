package tech.flowcatalyst.resourcebridge.testing;

import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditLog;
import tech.flowcatalyst.resourcebridge.audit.AuditLogRepository;
import tech.flowcatalyst.resourcebridge.shared.EntityType;
import tech.flowcatalyst.resourcebridge.shared.TsidGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class InMemoryAuditLogRepository implements AuditLogRepository, Snapshotable {

    private List<AuditLog> entries = new ArrayList<>();

    @Override
    public void persist(AuditLog log) {
        if (log.id == null) {
            log.id = TsidGenerator.generate(EntityType.AUDIT_LOG);
        }
        entries.add(log);
    }

    @Override
    public List<AuditLog> findByObject(String resource, String objectId, int limit) {
        List<AuditLog> matches = new ArrayList<>();
        for (AuditLog log : entries) {
            if (log.resource.equals(resource) && log.objectId.equals(objectId)) {
                matches.add(log);
            }
        }
        Collections.reverse(matches);
        return matches.size() > limit ? matches.subList(0, limit) : matches;
    }

    @Override
    public long countByObject(String resource, String objectId) {
        return entries.stream()
            .filter(log -> log.resource.equals(resource) && log.objectId.equals(objectId))
            .count();
    }

    public List<AuditLog> all() {
        return List.copyOf(entries);
    }

    public List<AuditLog> ofKind(AuditKind kind) {
        return entries.stream().filter(log -> log.kind == kind).toList();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public Object snapshot() {
        return new ArrayList<>(entries);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void restore(Object snapshot) {
        entries = new ArrayList<>((List<AuditLog>) snapshot);
    }
}
