package tech.flowcatalyst.resourcebridge.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.Optional;

/**
 * Decides whether a principal may perform an action on a resource.
 *
 * <p>Decision order:
 * <ol>
 *   <li>Descriptor declares no policy: allowed if allow-undeclared-policy</li>
 *   <li>No principal: allowed if allow-anonymous</li>
 *   <li>Action outside view/add/change/delete: allowed if allow-unknown-action</li>
 *   <li>Otherwise the descriptor decides against the principal's effective permissions</li>
 * </ol>
 *
 * <p>Nothing is cached; every call evaluates the principal's grants as loaded
 * for the current request.
 */
@ApplicationScoped
public class PermissionGate {

    private static final Logger LOG = Logger.getLogger(PermissionGate.class);

    @Inject
    ResourceBridgeConfig config;

    public boolean isAllowed(Principal principal, ResourceDescriptor descriptor, String action) {
        if (descriptor == null || !descriptor.declaresPermissionPolicy()) {
            return config.authorization().allowUndeclaredPolicy();
        }
        if (principal == null) {
            return config.authorization().allowAnonymous();
        }
        Optional<PermissionAction> known = PermissionAction.fromCode(action);
        if (known.isEmpty()) {
            return config.authorization().allowUnknownAction();
        }
        return descriptor.hasPermission(principal, known.get());
    }

    public boolean isAllowed(Principal principal, ResourceDescriptor descriptor, PermissionAction action) {
        return isAllowed(principal, descriptor, action.code());
    }

    /**
     * Check the action and return a uniform permission error when denied.
     *
     * @return success, or a failure carrying exactly the action and resource
     */
    public Result<Void> authorize(Principal principal, ResourceDescriptor descriptor, String action) {
        if (isAllowed(principal, descriptor, action)) {
            return Result.success(null);
        }
        String resource = descriptor != null ? descriptor.name() : "unknown";
        LOG.debugf("Permission denied: principal [%s] cannot %s %s",
            principal != null ? principal.id() : "anonymous", action, resource);
        return Result.failure(UseCaseError.permissionDenied(action, resource));
    }

    public Result<Void> authorize(Principal principal, ResourceDescriptor descriptor, PermissionAction action) {
        return authorize(principal, descriptor, action.code());
    }
}
