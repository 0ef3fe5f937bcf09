package tech.flowcatalyst.resourcebridge.engine.operations.recordhistory;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.audit.AuditLog;
import tech.flowcatalyst.resourcebridge.audit.AuditLogRepository;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;

import java.util.List;

/**
 * Use case for reading the audit history of an existing record.
 */
@ApplicationScoped
public class RecordHistoryUseCase {

    @Inject
    AuditLogRepository auditLogRepository;

    @Inject
    ResourceBridgeConfig config;

    public Result<RecordHistory> execute(RegisteredResource resource, RecordHistoryCommand command, ExecutionContext context) {
        Result<Object> idResult = RecordIds.coerce(resource.descriptor(), command.id());
        if (idResult instanceof Result.Failure<Object> f) {
            return f.cast();
        }
        Object id = ((Result.Success<Object>) idResult).value();

        int limit = command.limit() != null ? command.limit() : config.engine().historyDefaultLimit();
        if (limit < 0) {
            return Result.failure(UseCaseError.invalidInput("limit must be a non-negative integer"));
        }

        if (resource.store().findById(id).isEmpty()) {
            return Result.failure(UseCaseError.notFound(resource.name() + " not found"));
        }

        List<RecordHistory.Entry> entries = auditLogRepository
            .findByObject(resource.name(), String.valueOf(id), limit)
            .stream()
            .map(RecordHistoryUseCase::toEntry)
            .toList();

        return Result.success(new RecordHistory(resource.name(), id, entries.size(), entries));
    }

    private static RecordHistory.Entry toEntry(AuditLog log) {
        return new RecordHistory.Entry(log.kind.historyLabel(), log.performedAt, log.principalId, log.changeMessage);
    }
}
