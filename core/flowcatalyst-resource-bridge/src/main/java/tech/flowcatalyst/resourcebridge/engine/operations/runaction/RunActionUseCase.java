package tech.flowcatalyst.resourcebridge.engine.operations.runaction;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditService;
import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGate;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.UnitOfWork;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.engine.ChangeMessages;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.resource.RecordAction;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Use case for running the built-in delete_selected action or a custom
 * action over selected records, in one unit of work.
 *
 * <p>Running an action needs change permission, checked by the caller.
 * delete_selected additionally needs delete permission, checked here.
 */
@ApplicationScoped
public class RunActionUseCase {

    private static final Logger LOG = Logger.getLogger(RunActionUseCase.class);

    public static final String DELETE_SELECTED = "delete_selected";

    @Inject
    PermissionGate permissionGate;

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ActionExecuted> execute(RegisteredResource resource, RunActionCommand command, ExecutionContext context) {
        ResourceDescriptor descriptor = resource.descriptor();

        if (command.action() == null || command.action().isBlank()) {
            return Result.failure(UseCaseError.validation("action parameter is required"));
        }
        if (command.ids() == null || command.ids().isEmpty()) {
            return Result.failure(UseCaseError.validation("ids parameter is required"));
        }

        Result<List<Object>> ids = RecordIds.coerceAll(descriptor, command.ids());
        if (ids instanceof Result.Failure<List<Object>> f) {
            return f.cast();
        }

        List<Map<String, Object>> records = resource.store().findByIds(((Result.Success<List<Object>>) ids).value());
        if (records.isEmpty()) {
            return Result.failure(UseCaseError.notFound("No objects found with the provided IDs"));
        }

        if (DELETE_SELECTED.equals(command.action())) {
            Result<Void> allowed = permissionGate.authorize(context.principal(), descriptor, PermissionAction.DELETE);
            if (allowed instanceof Result.Failure<Void> f) {
                return f.cast();
            }
            return deleteSelected(resource, records, context);
        }

        Optional<RecordAction> action = descriptor.actions().stream()
            .filter(a -> a.name().equals(command.action()))
            .findFirst();
        if (action.isEmpty()) {
            return Result.failure(UseCaseError.notFound("Action '" + command.action() + "' not found"));
        }

        return unitOfWork.execute(() -> {
            Optional<String> outcome = action.get().apply(records, context);
            LOG.infof("Executed action [%s] on %d %s record(s)", action.get().name(), records.size(), descriptor.name());
            return Result.success(new ActionExecuted(
                true,
                action.get().name(),
                records.size(),
                "Executed " + action.get().name() + " on " + records.size() + " objects",
                outcome.orElse(null)
            ));
        });
    }

    private Result<ActionExecuted> deleteSelected(
            RegisteredResource resource,
            List<Map<String, Object>> records,
            ExecutionContext context
    ) {
        ResourceDescriptor descriptor = resource.descriptor();
        String primaryKey = descriptor.primaryKey().name();

        return unitOfWork.execute(() -> {
            for (Map<String, Object> record : records) {
                Object id = record.get(primaryKey);
                auditService.record(
                    context,
                    descriptor.name(),
                    id,
                    descriptor.displayText(record),
                    AuditKind.DELETION,
                    ChangeMessages.DELETED
                );
                resource.store().delete(id);
            }
            LOG.infof("Deleted %d %s record(s) via %s", records.size(), descriptor.name(), DELETE_SELECTED);
            return Result.success(new ActionExecuted(
                true,
                DELETE_SELECTED,
                records.size(),
                "Deleted " + records.size() + " " + descriptor.verboseNamePlural(),
                null
            ));
        });
    }
}
