package tech.flowcatalyst.resourcebridge.authorization;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An authenticated actor.
 *
 * <p>Permissions come from two sources: grants held directly and grants of
 * every group the principal belongs to. The effective set is their union and
 * is computed on each call, so group changes loaded for the current request
 * are always reflected.
 *
 * @param id                identifier of the authenticated credential
 * @param auditPrincipalId  principal recorded in audit entries, may be null
 * @param displayName       human-readable name for logs
 * @param directPermissions grants held directly
 * @param groups            groups the principal belongs to
 */
public record Principal(
    String id,
    String auditPrincipalId,
    String displayName,
    Set<Permission> directPermissions,
    List<PermissionGroup> groups
) {

    public Principal {
        directPermissions = directPermissions != null ? Set.copyOf(directPermissions) : Set.of();
        groups = groups != null ? List.copyOf(groups) : List.of();
    }

    public Set<Permission> effectivePermissions() {
        Set<Permission> effective = new HashSet<>(directPermissions);
        for (PermissionGroup group : groups) {
            if (group.permissions != null) {
                effective.addAll(group.permissions);
            }
        }
        return effective;
    }

    public boolean hasPermission(Permission permission) {
        if (directPermissions.contains(permission)) {
            return true;
        }
        for (PermissionGroup group : groups) {
            if (group.permissions != null && group.permissions.contains(permission)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasPermission(String resource, PermissionAction action) {
        return hasPermission(Permission.of(resource, action));
    }
}
