package tech.flowcatalyst.resourcebridge.audit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;

import java.time.Instant;

/**
 * JPA entity for resource_bridge_audit_logs table.
 */
@Entity
@Table(
    name = "resource_bridge_audit_logs",
    indexes = @Index(name = "idx_rb_audit_object", columnList = "resource, object_id, performed_at")
)
public class AuditLogEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "resource", nullable = false, length = 100)
    public String resource;

    @Column(name = "object_id", nullable = false, length = 100)
    public String objectId;

    @Column(name = "object_repr", length = 200)
    public String objectRepr;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    public AuditKind kind;

    @Column(name = "change_message", columnDefinition = "text")
    public String changeMessage;

    @Column(name = "principal_id", nullable = false, length = 100)
    public String principalId;

    @Column(name = "performed_at", nullable = false)
    public Instant performedAt;

    public AuditLogEntity() {
    }
}
