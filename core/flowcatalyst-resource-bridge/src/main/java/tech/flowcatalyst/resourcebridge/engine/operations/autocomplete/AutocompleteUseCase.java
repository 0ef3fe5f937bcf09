package tech.flowcatalyst.resourcebridge.engine.operations.autocomplete;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.engine.QueryTranslator;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceQuery;

import java.util.List;
import java.util.Map;

/**
 * Use case for autocomplete suggestions.
 *
 * <p>The term is matched against the searchable fields, or against every
 * textual field when the resource declares none.
 */
@ApplicationScoped
public class AutocompleteUseCase {

    @Inject
    ResourceBridgeConfig config;

    public Result<Suggestions> execute(RegisteredResource resource, AutocompleteCommand command, ExecutionContext context) {
        ResourceDescriptor descriptor = resource.descriptor();
        int limit = command.limit() != null ? command.limit() : config.engine().autocompleteDefaultLimit();
        if (limit < 0) {
            return Result.failure(UseCaseError.invalidInput("limit must be a non-negative integer"));
        }

        ResourceQuery query = new ResourceQuery(
            List.of(),
            command.term(),
            searchFields(descriptor),
            QueryTranslator.ordering(descriptor, descriptor.defaultOrdering()),
            0,
            limit
        );
        OffsetPage<Map<String, Object>> page = resource.store().query(query);

        String primaryKey = descriptor.primaryKey().name();
        List<Suggestions.Suggestion> results = page.items().stream()
            .map(record -> new Suggestions.Suggestion(record.get(primaryKey), descriptor.displayText(record)))
            .toList();

        return Result.success(new Suggestions(resource.name(), command.term(), results.size(), results));
    }

    static List<String> searchFields(ResourceDescriptor descriptor) {
        if (!descriptor.exposedSearchFields().isEmpty()) {
            return descriptor.exposedSearchFields();
        }
        return descriptor.exposedFields().stream()
            .filter(field -> field.type().isTextual())
            .map(FieldDescriptor::name)
            .toList();
    }
}
