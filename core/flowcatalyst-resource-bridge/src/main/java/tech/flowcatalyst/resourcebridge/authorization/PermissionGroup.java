package tech.flowcatalyst.resourcebridge.authorization;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Named set of permissions that credentials can be a member of.
 */
public class PermissionGroup {

    public String id;

    /**
     * Unique group name (e.g., "editors").
     */
    public String name;

    public String description;

    public Set<Permission> permissions = new HashSet<>();

    public Instant createdAt = Instant.now();

    public PermissionGroup() {
    }

    public PermissionGroup(String name, Set<Permission> permissions) {
        this.name = name;
        this.permissions = new HashSet<>(permissions);
    }
}
