package tech.flowcatalyst.resourcebridge.engine.operations.listrecords;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.config.ResourceBridgeConfig;
import tech.flowcatalyst.resourcebridge.engine.QueryTranslator;
import tech.flowcatalyst.resourcebridge.engine.RecordSerializer;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceQuery;

import java.util.Map;

/**
 * Use case for listing records with filters, search, ordering and pagination.
 */
@ApplicationScoped
public class ListRecordsUseCase {

    private static final Logger LOG = Logger.getLogger(ListRecordsUseCase.class);

    @Inject
    ResourceBridgeConfig config;

    public Result<RecordList> execute(RegisteredResource resource, ListRecordsCommand command, ExecutionContext context) {
        int limit = command.limit() != null ? command.limit() : config.engine().defaultListLimit();
        if (limit < 0 || command.offset() < 0) {
            return Result.failure(UseCaseError.invalidInput("limit and offset must be non-negative integers"));
        }

        ResourceQuery query;
        try {
            query = QueryTranslator.translate(
                resource.descriptor(),
                command.filters(),
                command.search(),
                command.orderBy(),
                command.offset(),
                limit
            );
        } catch (IllegalArgumentException e) {
            LOG.debugf("Rejected filters for %s: %s", resource.name(), e.getMessage());
            return Result.failure(UseCaseError.invalidInput("Invalid filter value: " + e.getMessage()));
        }

        OffsetPage<Map<String, Object>> page = resource.store().query(query);
        return Result.success(new RecordList(
            page.count(),
            page.total(),
            RecordSerializer.serializeAll(resource.descriptor(), page.items())
        ));
    }
}
