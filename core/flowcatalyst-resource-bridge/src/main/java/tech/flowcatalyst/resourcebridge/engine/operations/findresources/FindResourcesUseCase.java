package tech.flowcatalyst.resourcebridge.engine.operations.findresources;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGate;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Use case for discovering registered resources the principal may view.
 *
 * <p>The optional query matches the resource name or verbose name, ignoring case.
 */
@ApplicationScoped
public class FindResourcesUseCase {

    @Inject
    ResourceRegistry registry;

    @Inject
    PermissionGate permissionGate;

    public Result<ResourceCatalog> execute(String query, ExecutionContext context) {
        String needle = query != null && !query.isBlank() ? query.trim().toLowerCase(Locale.ROOT) : null;

        List<ResourceCatalog.Entry> entries = new ArrayList<>();
        for (RegisteredResource resource : registry.all()) {
            ResourceDescriptor descriptor = resource.descriptor();
            if (!matches(needle, descriptor)) {
                continue;
            }
            if (!permissionGate.isAllowed(context.principal(), descriptor, PermissionAction.VIEW)) {
                continue;
            }
            entries.add(new ResourceCatalog.Entry(
                descriptor.name(),
                descriptor.verboseName(),
                descriptor.verboseNamePlural(),
                descriptor.appLabel(),
                true
            ));
        }
        entries.sort(Comparator.comparing(ResourceCatalog.Entry::modelName));
        return Result.success(new ResourceCatalog(entries.size(), entries));
    }

    private static boolean matches(String needle, ResourceDescriptor descriptor) {
        if (needle == null) {
            return true;
        }
        return descriptor.name().toLowerCase(Locale.ROOT).contains(needle)
            || descriptor.verboseName().toLowerCase(Locale.ROOT).contains(needle);
    }
}
