package tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.ExceptionTranslator;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.engine.ChangeMessages;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.engine.RecordValidator;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.CreateRecordUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.RecordCreated;
import tech.flowcatalyst.resourcebridge.engine.operations.deleterecord.DeleteRecordUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.updaterecord.UpdateRecordUseCase;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Use case for bulk create, update and delete.
 *
 * <p>Every item runs the single-record logic in its own unit of work. An item
 * failure is recorded with its index and never aborts the batch; items
 * already committed stay committed. Permission is checked by the caller, once
 * per batch.
 */
@ApplicationScoped
public class BulkMutateUseCase {

    private static final Logger LOG = Logger.getLogger(BulkMutateUseCase.class);

    static final String VALIDATION_FAILED = "Validation failed";
    static final String ID_REQUIRED_FOR_UPDATE = "id is required for update";
    static final String ITEM_NOT_OBJECT = "Item must be an object";

    @Inject
    CreateRecordUseCase createUseCase;

    @Inject
    UpdateRecordUseCase updateUseCase;

    @Inject
    DeleteRecordUseCase deleteUseCase;

    @Inject
    ResourceBridgeConfig config;

    public Result<BulkResult> execute(RegisteredResource resource, BulkMutateCommand command, ExecutionContext context) {
        BulkOperation operation = command.operation();
        List<Object> items = command.items();
        List<BulkResult.ItemSuccess> successes = new ArrayList<>();
        List<BulkResult.ItemError> errors = new ArrayList<>();

        for (int index = 0; index < items.size(); index++) {
            Object item = items.get(index);
            Result<Object> outcome;
            try {
                outcome = applyItem(resource, operation, item, context);
            } catch (RuntimeException e) {
                outcome = Result.failure(ExceptionTranslator.translate(e, "bulk " + operation.code()));
            }

            if (outcome instanceof Result.Success<Object> s) {
                successes.add(BulkResult.ItemSuccess.of(operation, index, s.value()));
            } else {
                errors.add(toItemError(index, item, ((Result.Failure<Object>) outcome).error()));
            }
        }

        LOG.infof("Bulk %s on %s: %d succeeded, %d failed",
            operation.code(), resource.name(), successes.size(), errors.size());

        return Result.success(new BulkResult(
            operation.code(),
            items.size(),
            successes.size(),
            errors.size(),
            new BulkResult.Results(successes, errors)
        ));
    }

    @SuppressWarnings("unchecked")
    private Result<Object> applyItem(
            RegisteredResource resource,
            BulkOperation operation,
            Object item,
            ExecutionContext context
    ) {
        switch (operation) {
            case CREATE -> {
                if (!(item instanceof Map)) {
                    return Result.failure(UseCaseError.validation(ITEM_NOT_OBJECT));
                }
                Result<RecordCreated> created = createUseCase.create(
                    resource, (Map<String, Object>) item, context, data -> ChangeMessages.BULK_CREATED);
                if (created instanceof Result.Failure<RecordCreated> f) {
                    return f.cast();
                }
                return Result.success(((Result.Success<RecordCreated>) created).value().id());
            }
            case UPDATE -> {
                if (!(item instanceof Map)) {
                    return Result.failure(UseCaseError.validation(ITEM_NOT_OBJECT));
                }
                Map<String, Object> entry = (Map<String, Object>) item;
                Object id = entry.get("id");
                if (RecordIds.isMissing(id)) {
                    return Result.failure(UseCaseError.validation(ID_REQUIRED_FOR_UPDATE));
                }
                Object rawData = entry.get("data");
                Map<String, Object> data = rawData instanceof Map ? (Map<String, Object>) rawData : Map.of();
                int maxLength = config.engine().bulkChangeMessageMaxLength();
                Result<?> updated = updateUseCase.update(
                    resource, id, data, Map.of(), context,
                    (changed, inlineNames) -> ChangeMessages.bulkUpdated(changed, maxLength));
                if (updated instanceof Result.Failure<?> f) {
                    return f.cast();
                }
                return Result.success(id);
            }
            default -> {
                Result<?> deleted = deleteUseCase.delete(resource, item, context, ChangeMessages.BULK_DELETED);
                if (deleted instanceof Result.Failure<?> f) {
                    return f.cast();
                }
                return Result.success(item);
            }
        }
    }

    private static BulkResult.ItemError toItemError(int index, Object item, UseCaseError error) {
        if (error.code() == ErrorCode.NOT_FOUND) {
            Object id = item instanceof Map<?, ?> map ? map.get("id") : item;
            return new BulkResult.ItemError(index, "Object with id " + id + " not found", error.code().wireName(), null);
        }
        Object validationErrors = error.details().get(RecordValidator.VALIDATION_ERRORS);
        String message = validationErrors != null ? VALIDATION_FAILED : error.message();
        return new BulkResult.ItemError(index, message, error.code().wireName(), validationErrors);
    }
}
