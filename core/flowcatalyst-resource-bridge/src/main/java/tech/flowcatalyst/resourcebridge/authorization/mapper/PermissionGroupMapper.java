package tech.flowcatalyst.resourcebridge.authorization.mapper;

import tech.flowcatalyst.resourcebridge.authorization.Permission;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGroup;
import tech.flowcatalyst.resourcebridge.authorization.entity.PermissionGroupEntity;

import java.util.HashSet;
import java.util.Set;

/**
 * Mapper between PermissionGroup domain model and PermissionGroupEntity.
 */
public final class PermissionGroupMapper {

    private PermissionGroupMapper() {
    }

    public static PermissionGroup toDomain(PermissionGroupEntity entity) {
        if (entity == null) {
            return null;
        }

        PermissionGroup group = new PermissionGroup();
        group.id = entity.id;
        group.name = entity.name;
        group.description = entity.description;
        Set<Permission> permissions = new HashSet<>();
        for (String value : entity.permissions) {
            permissions.add(Permission.parse(value));
        }
        group.permissions = permissions;
        group.createdAt = entity.createdAt;
        return group;
    }

    public static PermissionGroupEntity toEntity(PermissionGroup domain) {
        if (domain == null) {
            return null;
        }

        PermissionGroupEntity entity = new PermissionGroupEntity();
        entity.id = domain.id;
        entity.name = domain.name;
        entity.description = domain.description;
        for (Permission permission : domain.permissions) {
            entity.permissions.add(permission.toStorageString());
        }
        entity.createdAt = domain.createdAt;
        return entity;
    }
}
