package tech.flowcatalyst.resourcebridge.engine.operations.getrecord;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.engine.QueryTranslator;
import tech.flowcatalyst.resourcebridge.engine.RecordIds;
import tech.flowcatalyst.resourcebridge.engine.RecordSerializer;
import tech.flowcatalyst.resourcebridge.resource.ChildDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldFilter;
import tech.flowcatalyst.resourcebridge.resource.FilterLookup;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.RelationDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceQuery;
import tech.flowcatalyst.resourcebridge.resource.ResourceRegistry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Use case for fetching a single record, optionally with its children and
 * relation previews.
 */
@ApplicationScoped
public class GetRecordUseCase {

    private static final Logger LOG = Logger.getLogger(GetRecordUseCase.class);

    public static final String INLINES_KEY = "_inlines";
    public static final String RELATED_KEY = "_related";

    @Inject
    ResourceRegistry registry;

    @Inject
    ResourceBridgeConfig config;

    public Result<Map<String, Object>> execute(RegisteredResource resource, GetRecordCommand command, ExecutionContext context) {
        ResourceDescriptor descriptor = resource.descriptor();

        Result<Object> idResult = RecordIds.coerce(descriptor, command.id());
        if (idResult instanceof Result.Failure<Object> f) {
            return f.cast();
        }
        Object id = ((Result.Success<Object>) idResult).value();

        Optional<Map<String, Object>> record = resource.store().findById(id);
        if (record.isEmpty()) {
            return Result.failure(UseCaseError.notFound(descriptor.name() + " not found"));
        }

        Map<String, Object> result = RecordSerializer.serialize(descriptor, record.get());
        if (command.includeInlines()) {
            result.put(INLINES_KEY, inlines(descriptor, id));
        }
        if (command.includeRelated()) {
            Map<String, Object> related = related(resource, id);
            if (!related.isEmpty()) {
                result.put(RELATED_KEY, related);
            }
        }
        return Result.success(result);
    }

    private Map<String, Object> inlines(ResourceDescriptor descriptor, Object parentId) {
        Map<String, Object> inlines = new LinkedHashMap<>();
        for (ChildDescriptor child : descriptor.childDescriptors()) {
            Optional<RegisteredResource> childResource = registry.find(child.resource());
            if (childResource.isEmpty()) {
                LOG.warnf("Inline [%s] of %s is not registered, skipping", child.resource(), descriptor.name());
                continue;
            }
            ResourceDescriptor childDescriptor = childResource.get().descriptor();
            ResourceQuery query = ResourceQuery.where(
                new FieldFilter(child.fkField(), FilterLookup.EXACT, parentId),
                QueryTranslator.ordering(childDescriptor, childDescriptor.defaultOrdering()),
                0,
                config.engine().inlineLimit()
            );
            OffsetPage<Map<String, Object>> page = childResource.get().store().query(query);
            inlines.put(child.resource(), RecordSerializer.serializeAll(childDescriptor, page.items()));
        }
        return inlines;
    }

    private Map<String, Object> related(RegisteredResource resource, Object id) {
        Map<String, Object> related = new LinkedHashMap<>();
        for (RelationDescriptor relation : resource.descriptor().relations()) {
            Optional<RegisteredResource> target = registry.find(relation.targetResource());
            if (target.isEmpty()) {
                LOG.warnf("Relation [%s] of %s targets unregistered %s, skipping",
                    relation.name(), resource.name(), relation.targetResource());
                continue;
            }
            OffsetPage<Map<String, Object>> page = resource.store()
                .findRelated(id, relation.name(), 0, config.engine().relatedPreviewLimit());
            List<Map<String, Object>> items = RecordSerializer.serializeAll(target.get().descriptor(), page.items());
            if (!items.isEmpty()) {
                related.put(relation.name(), items);
            }
        }
        return related;
    }
}
