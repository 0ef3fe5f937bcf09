package tech.flowcatalyst.resourcebridge.engine.operations.listrelated;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.engine.RecordSerializer;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.RelationDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Use case for paging through a record's to-many relation.
 */
@ApplicationScoped
public class ListRelatedUseCase {

    @Inject
    ResourceRegistry registry;

    @Inject
    ResourceBridgeConfig config;

    public Result<RelatedRecords> execute(RegisteredResource resource, ListRelatedCommand command, ExecutionContext context) {
        Result<Object> idResult = RecordIds.coerce(resource.descriptor(), command.id());
        if (idResult instanceof Result.Failure<Object> f) {
            return f.cast();
        }
        Object id = ((Result.Success<Object>) idResult).value();

        if (command.relation() == null || command.relation().isBlank()) {
            return Result.failure(UseCaseError.validation("relation parameter is required"));
        }
        Optional<RelationDescriptor> relation = resource.descriptor().relation(command.relation());
        if (relation.isEmpty()) {
            return Result.failure(UseCaseError.validation("Unknown relation: " + command.relation()));
        }

        int limit = command.limit() != null ? command.limit() : config.engine().defaultListLimit();
        if (limit < 0 || command.offset() < 0) {
            return Result.failure(UseCaseError.invalidInput("limit and offset must be non-negative integers"));
        }

        if (resource.store().findById(id).isEmpty()) {
            return Result.failure(UseCaseError.notFound(resource.name() + " not found"));
        }

        OffsetPage<Map<String, Object>> page = resource.store()
            .findRelated(id, relation.get().name(), command.offset(), limit);
        List<Map<String, Object>> results = registry.find(relation.get().targetResource())
            .map(target -> RecordSerializer.serializeAll(target.descriptor(), page.items()))
            .orElseGet(() -> new ArrayList<>(page.items()));

        return Result.success(new RelatedRecords(relation.get().name(), RelatedRecords.MANY, page.total(), results.size(), results));
    }
}
