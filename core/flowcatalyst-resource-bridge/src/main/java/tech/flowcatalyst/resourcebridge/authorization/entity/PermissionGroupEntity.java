package tech.flowcatalyst.resourcebridge.authorization.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * JPA Entity for resource_bridge_permission_groups table.
 */
@Entity
@Table(name = "resource_bridge_permission_groups")
public class PermissionGroupEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    public String name;

    @Column(name = "description", length = 500)
    public String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "resource_bridge_permission_group_grants",
        joinColumns = @JoinColumn(name = "group_id")
    )
    @Column(name = "permission", nullable = false, length = 150)
    public Set<String> permissions = new HashSet<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    public PermissionGroupEntity() {
    }
}
