package tech.flowcatalyst.resourcebridge.credential.mapper;

import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.authorization.Permission;
import tech.flowcatalyst.resourcebridge.credential.Credential;
import tech.flowcatalyst.resourcebridge.credential.entity.CredentialEntity;

import java.util.HashSet;
import java.util.Set;

/**
 * Mapper for converting between Credential domain and JPA entities.
 */
public final class CredentialMapper {

    private static final Logger LOG = Logger.getLogger(CredentialMapper.class);

    private CredentialMapper() {
    }

    public static Credential toDomain(CredentialEntity entity) {
        if (entity == null) {
            return null;
        }

        Credential credential = new Credential();
        credential.id = entity.id;
        credential.name = entity.name;
        credential.tokenKey = entity.tokenKey;
        credential.secretHash = entity.secretHash;
        credential.salt = entity.salt;
        credential.ownerPrincipalId = entity.ownerPrincipalId;
        credential.active = entity.active;
        credential.expiresAt = entity.expiresAt;
        credential.lastUsedAt = entity.lastUsedAt;
        credential.permissions = toPermissions(entity.permissions, entity.id);
        credential.groupNames = entity.groupNames != null ? new HashSet<>(entity.groupNames) : new HashSet<>();
        credential.createdAt = entity.createdAt;
        credential.updatedAt = entity.updatedAt;
        return credential;
    }

    public static CredentialEntity toEntity(Credential domain) {
        if (domain == null) {
            return null;
        }

        CredentialEntity entity = new CredentialEntity();
        entity.id = domain.id;
        updateEntity(entity, domain);
        entity.createdAt = domain.createdAt;
        return entity;
    }

    /**
     * Copy mutable state onto a managed entity. The id and creation time never change.
     */
    public static void updateEntity(CredentialEntity entity, Credential domain) {
        entity.name = domain.name;
        entity.tokenKey = domain.tokenKey;
        entity.secretHash = domain.secretHash;
        entity.salt = domain.salt;
        entity.ownerPrincipalId = domain.ownerPrincipalId;
        entity.active = domain.active;
        entity.expiresAt = domain.expiresAt;
        entity.lastUsedAt = domain.lastUsedAt;
        entity.updatedAt = domain.updatedAt;

        Set<String> permissions = new HashSet<>();
        for (Permission permission : domain.permissions) {
            permissions.add(permission.toStorageString());
        }
        replace(entity.permissions, permissions);
        replace(entity.groupNames, domain.groupNames);
    }

    private static Set<Permission> toPermissions(Set<String> stored, String credentialId) {
        Set<Permission> permissions = new HashSet<>();
        if (stored == null) {
            return permissions;
        }
        for (String value : stored) {
            try {
                permissions.add(Permission.parse(value));
            } catch (IllegalArgumentException e) {
                LOG.warnf("Ignoring malformed permission [%s] on credential [%s]", value, credentialId);
            }
        }
        return permissions;
    }

    private static void replace(Set<String> target, Set<String> values) {
        target.clear();
        if (values != null) {
            target.addAll(values);
        }
    }
}
