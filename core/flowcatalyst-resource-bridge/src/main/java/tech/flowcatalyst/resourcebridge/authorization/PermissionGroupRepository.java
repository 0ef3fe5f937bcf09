package tech.flowcatalyst.resourcebridge.authorization;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for permission groups.
 */
public interface PermissionGroupRepository {

    Optional<PermissionGroup> findByName(String name);

    List<PermissionGroup> findByNames(Collection<String> names);

    List<PermissionGroup> listAll();

    void persist(PermissionGroup group);
}
