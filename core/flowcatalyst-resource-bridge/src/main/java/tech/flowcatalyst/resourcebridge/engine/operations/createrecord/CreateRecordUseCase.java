package tech.flowcatalyst.resourcebridge.engine.operations.createrecord;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditService;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.UnitOfWork;
import tech.flowcatalyst.resourcebridge.engine.ChangeMessages;
import tech.flowcatalyst.resourcebridge.engine.RecordSerializer;
import tech.flowcatalyst.resourcebridge.engine.RecordValidator;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Use case for creating a record.
 *
 * <p>The insert and its ADDITION audit entry commit in one unit of work.
 */
@ApplicationScoped
public class CreateRecordUseCase {

    private static final Logger LOG = Logger.getLogger(CreateRecordUseCase.class);

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RecordCreated> execute(RegisteredResource resource, CreateRecordCommand command, ExecutionContext context) {
        return create(resource, command.data(), context, ChangeMessages::created);
    }

    /**
     * Validate and insert one record in its own unit of work.
     *
     * @param changeMessage builds the audit change message from the caller's data
     */
    public Result<RecordCreated> create(
            RegisteredResource resource,
            Map<String, Object> data,
            ExecutionContext context,
            Function<Map<String, Object>, String> changeMessage
    ) {
        ResourceDescriptor descriptor = resource.descriptor();
        Map<String, Object> input = data != null ? data : Map.of();

        Result<Map<String, Object>> validated = RecordValidator.validateCreate(descriptor, input);
        if (validated instanceof Result.Failure<Map<String, Object>> f) {
            return f.cast();
        }
        Map<String, Object> values = ((Result.Success<Map<String, Object>>) validated).value();

        return unitOfWork.execute(() -> {
            Object id = resource.store().insert(values);
            Map<String, Object> stored = resource.store().findById(id).orElseGet(() -> {
                Map<String, Object> merged = new LinkedHashMap<>(values);
                merged.put(descriptor.primaryKey().name(), id);
                return merged;
            });

            auditService.record(
                context,
                descriptor.name(),
                id,
                descriptor.displayText(stored),
                AuditKind.ADDITION,
                changeMessage.apply(input)
            );

            LOG.debugf("Created %s [%s]", descriptor.name(), id);
            return Result.success(RecordCreated.of(id, RecordSerializer.serialize(descriptor, stored)));
        });
    }
}
