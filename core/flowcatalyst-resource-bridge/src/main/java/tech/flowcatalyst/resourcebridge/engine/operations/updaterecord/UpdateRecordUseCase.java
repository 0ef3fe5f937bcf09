package tech.flowcatalyst.resourcebridge.engine.operations.updaterecord;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.audit.AuditKind;
import tech.flowcatalyst.resourcebridge.audit.AuditService;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.UnitOfWork;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.engine.ChangeMessages;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.engine.RecordSerializer;
import tech.flowcatalyst.resourcebridge.engine.RecordValidator;
import tech.flowcatalyst.resourcebridge.resource.ChildDescriptor;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceRegistry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Use case for updating a record and its children.
 *
 * <p>Field checks run before anything is written. The parent change, every
 * child item and the CHANGE audit entry share one unit of work; each child
 * item runs in its own savepoint so a failing child is reported without
 * undoing its siblings or the parent.
 */
@ApplicationScoped
public class UpdateRecordUseCase {

    private static final Logger LOG = Logger.getLogger(UpdateRecordUseCase.class);

    static final String ITEM_ID = "id";
    static final String ITEM_DATA = "data";
    static final String ITEM_DELETE = "_delete";

    @Inject
    ResourceRegistry registry;

    @Inject
    AuditService auditService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RecordUpdated> execute(RegisteredResource resource, UpdateRecordCommand command, ExecutionContext context) {
        return update(resource, command.id(), command.data(), command.inlines(), context, ChangeMessages::changed);
    }

    /**
     * Validate and apply one update in its own unit of work.
     *
     * @param changeMessage builds the audit change message from the caller's
     *                      data and the names of the touched inlines
     */
    public Result<RecordUpdated> update(
            RegisteredResource resource,
            Object rawId,
            Map<String, Object> data,
            Map<String, List<Map<String, Object>>> inlines,
            ExecutionContext context,
            BiFunction<Map<String, Object>, Collection<String>, String> changeMessage
    ) {
        ResourceDescriptor descriptor = resource.descriptor();
        Map<String, Object> input = data != null ? data : Map.of();
        Map<String, List<Map<String, Object>>> inlineItems = inlines != null ? inlines : Map.of();

        Result<Object> idResult = RecordIds.coerce(descriptor, rawId);
        if (idResult instanceof Result.Failure<Object> f) {
            return f.cast();
        }
        Object id = ((Result.Success<Object>) idResult).value();

        Result<Map<String, Object>> validated = RecordValidator.validateUpdate(descriptor, input);
        if (validated instanceof Result.Failure<Map<String, Object>> f) {
            return f.cast();
        }
        Map<String, Object> values = ((Result.Success<Map<String, Object>>) validated).value();

        if (resource.store().findById(id).isEmpty()) {
            return Result.failure(UseCaseError.notFound(descriptor.name() + " not found"));
        }

        return unitOfWork.execute(() -> {
            if (!values.isEmpty()) {
                resource.store().update(id, values);
            }

            InlineResults inlineResults = InlineResults.empty();
            for (Map.Entry<String, List<Map<String, Object>>> entry : inlineItems.entrySet()) {
                applyInline(descriptor, id, entry.getKey(), entry.getValue(), inlineResults);
            }

            Map<String, Object> after = resource.store().findById(id)
                .orElseThrow(() -> new IllegalStateException(descriptor.name() + " [" + id + "] vanished during update"));

            auditService.record(
                context,
                descriptor.name(),
                id,
                descriptor.displayText(after),
                AuditKind.CHANGE,
                changeMessage.apply(input, inlineItems.keySet())
            );

            LOG.debugf("Updated %s [%s], %d inline group(s)", descriptor.name(), id, inlineItems.size());
            return Result.success(new RecordUpdated(
                true,
                RecordSerializer.serialize(descriptor, after),
                inlineResults.isEmpty() ? null : inlineResults
            ));
        });
    }

    private void applyInline(
            ResourceDescriptor parent,
            Object parentId,
            String childName,
            List<Map<String, Object>> items,
            InlineResults results
    ) {
        Optional<ChildDescriptor> declared = parent.childDescriptors().stream()
            .filter(c -> c.resource().equals(childName))
            .findFirst();
        Optional<RegisteredResource> child = declared.flatMap(c -> registry.find(c.resource()));
        if (child.isEmpty()) {
            LOG.debugf("Unknown inline [%s] on %s", childName, parent.name());
            results.errors().add(new InlineResults.ChildError(
                childName, null, "Unknown inline: " + childName, ErrorCode.VALIDATION_ERROR.wireName()));
            return;
        }
        if (items == null) {
            return;
        }

        String fkField = declared.get().fkField();
        for (Map<String, Object> item : items) {
            Object rawChildId = item != null ? item.get(ITEM_ID) : null;
            boolean delete = item != null && isTrue(item.get(ITEM_DELETE));
            Map<String, Object> childData = itemData(item);

            Result<Object> outcome = unitOfWork.executeNested(() -> {
                if (RecordIds.isMissing(rawChildId)) {
                    return createChild(child.get(), fkField, parentId, childData);
                }
                return changeChild(child.get(), fkField, parentId, rawChildId, childData, delete);
            });

            if (outcome instanceof Result.Success<Object> s) {
                InlineResults.ChildChange change = new InlineResults.ChildChange(childName, s.value());
                if (RecordIds.isMissing(rawChildId)) {
                    results.created().add(change);
                } else if (delete) {
                    results.deleted().add(change);
                } else {
                    results.updated().add(change);
                }
            } else {
                UseCaseError error = ((Result.Failure<Object>) outcome).error();
                results.errors().add(new InlineResults.ChildError(
                    childName, rawChildId, error.message(), error.code().wireName()));
            }
        }
    }

    private Result<Object> createChild(
            RegisteredResource child,
            String fkField,
            Object parentId,
            Map<String, Object> data
    ) throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>(data);
        payload.put(fkField, parentId);

        Result<Map<String, Object>> validated = RecordValidator.validateCreate(child.descriptor(), payload);
        if (validated instanceof Result.Failure<Map<String, Object>> f) {
            return f.cast();
        }
        return Result.success(child.store().insert(((Result.Success<Map<String, Object>>) validated).value()));
    }

    private Result<Object> changeChild(
            RegisteredResource child,
            String fkField,
            Object parentId,
            Object rawChildId,
            Map<String, Object> data,
            boolean delete
    ) throws Exception {
        Result<Object> idResult = RecordIds.coerce(child.descriptor(), rawChildId);
        if (idResult instanceof Result.Failure<Object> f) {
            return f;
        }
        Object childId = ((Result.Success<Object>) idResult).value();

        Optional<Map<String, Object>> existing = child.store().findById(childId);
        if (existing.isEmpty() || !belongsTo(existing.get(), fkField, parentId)) {
            return Result.failure(UseCaseError.notFound(child.name() + " not found"));
        }

        if (delete) {
            child.store().delete(childId);
            return Result.success(childId);
        }

        Result<Map<String, Object>> validated = RecordValidator.validateUpdate(child.descriptor(), data);
        if (validated instanceof Result.Failure<Map<String, Object>> f) {
            return f.cast();
        }
        Map<String, Object> values = ((Result.Success<Map<String, Object>>) validated).value();
        if (!values.isEmpty()) {
            child.store().update(childId, values);
        }
        return Result.success(childId);
    }

    private static boolean belongsTo(Map<String, Object> child, String fkField, Object parentId) {
        return Objects.equals(String.valueOf(child.get(fkField)), String.valueOf(parentId));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> itemData(Map<String, Object> item) {
        if (item == null) {
            return Map.of();
        }
        if (item.get(ITEM_DATA) instanceof Map<?, ?> nested) {
            return (Map<String, Object>) nested;
        }
        Map<String, Object> data = new LinkedHashMap<>(item);
        data.remove(ITEM_ID);
        data.remove(ITEM_DELETE);
        return data;
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value) || (value instanceof String s && "true".equalsIgnoreCase(s));
    }
}
