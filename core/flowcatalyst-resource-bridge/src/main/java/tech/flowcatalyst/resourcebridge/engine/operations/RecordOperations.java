package tech.flowcatalyst.resourcebridge.engine.operations;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.engine.operations.autocomplete.AutocompleteCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.autocomplete.AutocompleteUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.autocomplete.Suggestions;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkMutateCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkMutateUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate.BulkResult;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.CreateRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.CreateRecordUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.createrecord.RecordCreated;
import tech.flowcatalyst.resourcebridge.engine.operations.deleterecord.DeleteRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.deleterecord.DeleteRecordUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.deleterecord.RecordDeleted;
import tech.flowcatalyst.resourcebridge.engine.operations.describeresource.DescribeResourceUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.describeresource.ResourceDescription;
import tech.flowcatalyst.resourcebridge.engine.operations.findresources.FindResourcesUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.findresources.ResourceCatalog;
import tech.flowcatalyst.resourcebridge.engine.operations.getrecord.GetRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.getrecord.GetRecordUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.listactions.ActionList;
import tech.flowcatalyst.resourcebridge.engine.operations.listactions.ListActionsUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.ListRecordsCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.ListRecordsUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.listrecords.RecordList;
import tech.flowcatalyst.resourcebridge.engine.operations.listrelated.ListRelatedCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.listrelated.ListRelatedUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.listrelated.RelatedRecords;
import tech.flowcatalyst.resourcebridge.engine.operations.recordhistory.RecordHistory;
import tech.flowcatalyst.resourcebridge.engine.operations.recordhistory.RecordHistoryCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.recordhistory.RecordHistoryUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.runaction.ActionExecuted;
import tech.flowcatalyst.resourcebridge.engine.operations.runaction.RunActionCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.runaction.RunActionUseCase;
import tech.flowcatalyst.resourcebridge.engine.operations.updaterecord.RecordUpdated;
import tech.flowcatalyst.resourcebridge.engine.operations.updaterecord.UpdateRecordCommand;
import tech.flowcatalyst.resourcebridge.engine.operations.updaterecord.UpdateRecordUseCase;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;

import java.util.Map;

/**
 * Facade for all record operations of the execution engine.
 *
 * <p>Authorization is not checked here; callers go through the
 * {@link tech.flowcatalyst.resourcebridge.dispatch.CommandDispatcher}.
 */
@ApplicationScoped
public class RecordOperations {

    @Inject
    ListRecordsUseCase listUseCase;

    @Inject
    GetRecordUseCase getUseCase;

    @Inject
    CreateRecordUseCase createUseCase;

    @Inject
    UpdateRecordUseCase updateUseCase;

    @Inject
    DeleteRecordUseCase deleteUseCase;

    @Inject
    BulkMutateUseCase bulkUseCase;

    @Inject
    RunActionUseCase runActionUseCase;

    @Inject
    ListActionsUseCase listActionsUseCase;

    @Inject
    DescribeResourceUseCase describeUseCase;

    @Inject
    FindResourcesUseCase findResourcesUseCase;

    @Inject
    RecordHistoryUseCase historyUseCase;

    @Inject
    AutocompleteUseCase autocompleteUseCase;

    @Inject
    ListRelatedUseCase listRelatedUseCase;

    // ==================== MUTATIONS ====================

    public Result<RecordCreated> create(RegisteredResource resource, CreateRecordCommand command, ExecutionContext context) {
        return createUseCase.execute(resource, command, context);
    }

    public Result<RecordUpdated> update(RegisteredResource resource, UpdateRecordCommand command, ExecutionContext context) {
        return updateUseCase.execute(resource, command, context);
    }

    public Result<RecordDeleted> delete(RegisteredResource resource, DeleteRecordCommand command, ExecutionContext context) {
        return deleteUseCase.execute(resource, command, context);
    }

    /**
     * Apply one operation to many items, each committed on its own.
     */
    public Result<BulkResult> bulk(RegisteredResource resource, BulkMutateCommand command, ExecutionContext context) {
        return bulkUseCase.execute(resource, command, context);
    }

    public Result<ActionExecuted> runAction(RegisteredResource resource, RunActionCommand command, ExecutionContext context) {
        return runActionUseCase.execute(resource, command, context);
    }

    // ==================== QUERIES ====================

    public Result<RecordList> list(RegisteredResource resource, ListRecordsCommand command, ExecutionContext context) {
        return listUseCase.execute(resource, command, context);
    }

    public Result<Map<String, Object>> get(RegisteredResource resource, GetRecordCommand command, ExecutionContext context) {
        return getUseCase.execute(resource, command, context);
    }

    public Result<ActionList> listActions(RegisteredResource resource, ExecutionContext context) {
        return listActionsUseCase.execute(resource, context);
    }

    public Result<ResourceDescription> describe(RegisteredResource resource, ExecutionContext context) {
        return describeUseCase.execute(resource, context);
    }

    /**
     * Registered resources the principal may view, optionally narrowed by a query.
     */
    public Result<ResourceCatalog> findResources(String query, ExecutionContext context) {
        return findResourcesUseCase.execute(query, context);
    }

    public Result<RecordHistory> history(RegisteredResource resource, RecordHistoryCommand command, ExecutionContext context) {
        return historyUseCase.execute(resource, command, context);
    }

    public Result<Suggestions> autocomplete(RegisteredResource resource, AutocompleteCommand command, ExecutionContext context) {
        return autocompleteUseCase.execute(resource, command, context);
    }

    public Result<RelatedRecords> related(RegisteredResource resource, ListRelatedCommand command, ExecutionContext context) {
        return listRelatedUseCase.execute(resource, command, context);
    }
}
