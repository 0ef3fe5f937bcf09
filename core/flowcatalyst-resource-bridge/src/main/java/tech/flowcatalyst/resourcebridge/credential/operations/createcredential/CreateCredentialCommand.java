package tech.flowcatalyst.resourcebridge.credential.operations.createcredential;

import tech.flowcatalyst.resourcebridge.authorization.Permission;

import java.time.Instant;
import java.util.Set;

/**
 * Command to issue a new credential.
 *
 * @param name             Descriptive name
 * @param ownerPrincipalId Principal that actions are attributed to in audit entries
 * @param expiresAt        Explicit expiry, or null
 * @param neverExpires     When true the credential never expires; expiresAt is ignored
 * @param permissions      Direct grants
 * @param groupNames       Groups the credential belongs to
 */
public record CreateCredentialCommand(
    String name,
    String ownerPrincipalId,
    Instant expiresAt,
    boolean neverExpires,
    Set<Permission> permissions,
    Set<String> groupNames
) {

    /**
     * Credential with the configured default lifetime.
     */
    public static CreateCredentialCommand withDefaultExpiry(String name, String ownerPrincipalId,
                                                           Set<Permission> permissions, Set<String> groupNames) {
        return new CreateCredentialCommand(name, ownerPrincipalId, null, false, permissions, groupNames);
    }

    public static CreateCredentialCommand expiringAt(String name, String ownerPrincipalId, Instant expiresAt,
                                                     Set<Permission> permissions, Set<String> groupNames) {
        return new CreateCredentialCommand(name, ownerPrincipalId, expiresAt, false, permissions, groupNames);
    }

    public static CreateCredentialCommand neverExpiring(String name, String ownerPrincipalId,
                                                        Set<Permission> permissions, Set<String> groupNames) {
        return new CreateCredentialCommand(name, ownerPrincipalId, null, true, permissions, groupNames);
    }
}
