package tech.flowcatalyst.resourcebridge.credential;

import tech.flowcatalyst.resourcebridge.authorization.Permission;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A bearer credential for the command interface.
 *
 * <p>Permissions come from the credential's own direct grants and from its
 * groups. The owner is only recorded in audit entries; none of the owner's
 * own grants apply.
 *
 * <p>Only the salted hash of the secret is stored. The plaintext token is
 * returned once, when the credential is issued or regenerated.
 */
public class Credential {

    public String id;

    /**
     * Descriptive name (e.g., "Production API").
     */
    public String name;

    /**
     * Public lookup key embedded in the token. Unique and indexed.
     */
    public String tokenKey;

    /**
     * Hex SHA-256 of salt followed by secret.
     */
    public String secretHash;

    public String salt;

    /**
     * Principal that actions taken with this credential are attributed to.
     */
    public String ownerPrincipalId;

    public boolean active = true;

    /**
     * Null means the credential never expires.
     */
    public Instant expiresAt;

    public Instant lastUsedAt;

    public Set<Permission> permissions = new HashSet<>();

    /**
     * Names of the {@link tech.flowcatalyst.resourcebridge.authorization.PermissionGroup}s
     * the credential belongs to.
     */
    public Set<String> groupNames = new HashSet<>();

    public Instant createdAt;

    public Instant updatedAt;

    public Credential() {
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isValid(Instant now) {
        return active && !isExpired(now);
    }

    /**
     * Human-readable status ("Active", "Active (Indefinite)", "Inactive", "Expired").
     */
    public String status(Instant now) {
        if (!active) {
            return "Inactive";
        }
        if (isExpired(now)) {
            return "Expired";
        }
        return expiresAt == null ? "Active (Indefinite)" : "Active";
    }

    @Override
    public String toString() {
        if (secretHash != null && secretHash.length() >= 8) {
            return name + " (" + secretHash.substring(0, 8) + "...)";
        }
        return String.valueOf(name);
    }
}
