package tech.flowcatalyst.resourcebridge.credential.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * JPA Entity for resource_bridge_credentials table.
 * Direct permissions and group memberships are stored in collection tables.
 */
@Entity
@Table(
    name = "resource_bridge_credentials",
    indexes = {
        @Index(name = "idx_rb_credential_token_key", columnList = "token_key", unique = true),
        @Index(name = "idx_rb_credential_active_key", columnList = "active, token_key")
    }
)
public class CredentialEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, length = 200)
    public String name;

    @Column(name = "token_key", nullable = false, unique = true, length = 32)
    public String tokenKey;

    @Column(name = "secret_hash", nullable = false, length = 64)
    public String secretHash;

    @Column(name = "salt", nullable = false, length = 32)
    public String salt;

    @Column(name = "owner_principal_id", length = 100)
    public String ownerPrincipalId;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "expires_at")
    public Instant expiresAt;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "resource_bridge_credential_permissions",
        joinColumns = @JoinColumn(name = "credential_id")
    )
    @Column(name = "permission", nullable = false, length = 150)
    public Set<String> permissions = new HashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "resource_bridge_credential_groups",
        joinColumns = @JoinColumn(name = "credential_id")
    )
    @Column(name = "group_name", nullable = false, length = 100)
    public Set<String> groupNames = new HashSet<>();

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public CredentialEntity() {
    }
}
