package tech.flowcatalyst.resourcebridge.engine.operations.deleterecord;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditService;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.UnitOfWork;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.engine.ChangeMessages;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.Map;
import java.util.Optional;

/**
 * Use case for deleting a record.
 *
 * <p>The DELETION audit entry is written before the physical delete, within
 * the same unit of work, so the entry keeps the record's display text.
 */
@ApplicationScoped
public class DeleteRecordUseCase {

    private static final Logger LOG = Logger.getLogger(DeleteRecordUseCase.class);

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RecordDeleted> execute(RegisteredResource resource, DeleteRecordCommand command, ExecutionContext context) {
        return delete(resource, command.id(), context, ChangeMessages.DELETED);
    }

    public Result<RecordDeleted> delete(
            RegisteredResource resource,
            Object rawId,
            ExecutionContext context,
            String changeMessage
    ) {
        ResourceDescriptor descriptor = resource.descriptor();

        Result<Object> idResult = RecordIds.coerce(descriptor, rawId);
        if (idResult instanceof Result.Failure<Object> f) {
            return f.cast();
        }
        Object id = ((Result.Success<Object>) idResult).value();

        Optional<Map<String, Object>> existing = resource.store().findById(id);
        if (existing.isEmpty()) {
            return Result.failure(UseCaseError.notFound(descriptor.name() + " not found"));
        }

        return unitOfWork.execute(() -> {
            auditService.record(
                context,
                descriptor.name(),
                id,
                descriptor.displayText(existing.get()),
                AuditKind.DELETION,
                changeMessage
            );
            resource.store().delete(id);

            LOG.debugf("Deleted %s [%s]", descriptor.name(), id);
            return Result.success(new RecordDeleted(true, descriptor.name() + " deleted successfully"));
        });
    }
}
