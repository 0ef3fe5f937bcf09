package tech.flowcatalyst.resourcebridge.dispatch;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.authorization.PermissionGate;
import tech.flowcatalyst.resourcebridge.authorization.Principal;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.ExceptionTranslator;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.engine.operations.RecordOperations;
import tech.flowcatalyst.resourcebridge.engine.operations.autocomplete.AutocompleteCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkMutateCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkOperation;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.CreateRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.deleterecord.DeleteRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.getrecord.GetRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.ListRecordsCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.listrelated.ListRelatedCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.recordhistory.RecordHistoryCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.runaction.RunActionCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.updaterecord.UpdateRecordCommand;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;
import tech.flowcatalyst.resourcebridge.resource.ResourceRegistry;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the transport: parses a command identifier, resolves the
 * resource, checks permission and runs the matching engine operation.
 *
 * <p>Never throws. Every outcome, including unexpected exceptions, comes
 * back as an {@link OperationResult} carrying a code from the closed set.
 */
@ApplicationScoped
public class CommandDispatcher {

    private static final Logger LOG = Logger.getLogger(CommandDispatcher.class);

    public static final String FIND_MODELS = "find_models";

    @Inject
    ResourceRegistry registry;

    @Inject
    PermissionGate permissionGate;

    @Inject
    RecordOperations operations;

    @ActivateRequestContext
    public OperationResult dispatch(Principal principal, String command, Map<String, Object> arguments) {
        ExecutionContext context = ExecutionContext.create(principal);
        LOG.debugf("Dispatching [%s] for principal [%s], execution [%s]",
            command, principal != null ? principal.id() : "anonymous", context.executionId());
        try {
            return route(command, new CommandArguments(arguments), context);
        } catch (InvalidArgumentException e) {
            LOG.debugf("Rejected arguments for [%s]: %s", command, e.getMessage());
            return OperationResult.failure(UseCaseError.invalidInput(e.getMessage()));
        } catch (Exception e) {
            return OperationResult.failure(ExceptionTranslator.translate(e, command));
        }
    }

    /**
     * Dispatch on a worker thread so the caller's event loop is never blocked.
     */
    public Uni<OperationResult> dispatchAsync(Principal principal, String command, Map<String, Object> arguments) {
        return Uni.createFrom().item(() -> dispatch(principal, command, arguments))
            .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private OperationResult route(String command, CommandArguments args, ExecutionContext context) {
        if (FIND_MODELS.equals(command)) {
            return OperationResult.from(operations.findResources(args.string("query"), context));
        }

        Result<CommandName> parsed = CommandName.parse(command);
        if (parsed instanceof Result.Failure<CommandName> f) {
            return OperationResult.failure(f.error());
        }
        CommandName name = ((Result.Success<CommandName>) parsed).value();

        Optional<RegisteredResource> found = registry.find(name.resource());
        if (found.isEmpty()) {
            LOG.debugf("Unknown resource [%s] in command [%s]", name.resource(), command);
            return OperationResult.failure(UseCaseError.notFound("Resource '" + name.resource() + "' not found"));
        }
        RegisteredResource resource = found.get();

        PermissionAction required = name.operation().requiredAction();
        BulkOperation bulkOperation = null;
        if (name.operation() == OperationType.BULK) {
            String code = args.string("operation");
            if (code == null || code.isBlank()) {
                return OperationResult.failure(UseCaseError.validation(BulkOperation.REQUIRED_MESSAGE));
            }
            Optional<BulkOperation> operation = BulkOperation.fromCode(code);
            if (operation.isEmpty()) {
                return OperationResult.failure(UseCaseError.validation(BulkOperation.INVALID_MESSAGE));
            }
            bulkOperation = operation.get();
            required = bulkOperation.requiredAction();
        }

        Result<Void> allowed = permissionGate.authorize(context.principal(), resource.descriptor(), required);
        if (allowed instanceof Result.Failure<Void> f) {
            return OperationResult.failure(f.error());
        }

        return execute(name.operation(), resource, args, bulkOperation, context);
    }

    private OperationResult execute(
            OperationType operation,
            RegisteredResource resource,
            CommandArguments args,
            BulkOperation bulkOperation,
            ExecutionContext context
    ) {
        return switch (operation) {
            case LIST -> OperationResult.from(operations.list(resource, new ListRecordsCommand(
                args.map("filters"),
                args.string("search"),
                args.stringList("order_by"),
                args.integer("limit"),
                args.integer("offset", 0)
            ), context));
            case GET -> OperationResult.from(operations.get(resource, new GetRecordCommand(
                args.raw("id"),
                args.bool("include_inlines"),
                args.bool("include_related")
            ), context));
            case CREATE -> OperationResult.from(operations.create(resource, new CreateRecordCommand(args.map("data")), context));
            case UPDATE -> OperationResult.from(operations.update(resource, new UpdateRecordCommand(
                args.raw("id"),
                args.map("data"),
                args.inlines("inlines")
            ), context));
            case DELETE -> OperationResult.from(operations.delete(resource, new DeleteRecordCommand(args.raw("id")), context));
            case DESCRIBE -> OperationResult.from(operations.describe(resource, context));
            case ACTIONS -> OperationResult.from(operations.listActions(resource, context));
            case ACTION -> OperationResult.from(operations.runAction(resource, new RunActionCommand(
                args.string("action"),
                args.list("ids")
            ), context));
            case BULK -> OperationResult.from(operations.bulk(resource, new BulkMutateCommand(
                bulkOperation,
                args.list("items")
            ), context));
            case RELATED -> OperationResult.from(operations.related(resource, new ListRelatedCommand(
                args.raw("id"),
                args.string("relation"),
                args.integer("limit"),
                args.integer("offset", 0)
            ), context));
            case HISTORY -> OperationResult.from(operations.history(resource, new RecordHistoryCommand(
                args.raw("id"),
                args.integer("limit")
            ), context));
            case AUTOCOMPLETE -> OperationResult.from(operations.autocomplete(resource, new AutocompleteCommand(
                args.string("term"),
                args.integer("limit")
            ), context));
        };
    }
}
