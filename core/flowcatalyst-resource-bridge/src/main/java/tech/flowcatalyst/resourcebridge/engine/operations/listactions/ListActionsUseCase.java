package tech.flowcatalyst.resourcebridge.engine.operations.listactions;

import jakarta.enterprise.context.ApplicationScoped;
import tech.flowcatalyst.resourcebridge.common.ExecutionContext;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.engine.operations.runaction.RunActionUseCase;
import tech.flowcatalyst.resourcebridge.resource.RecordAction;
import tech.flowcatalyst.resourcebridge.resource.RegisteredResource;

import java.util.ArrayList;
import java.util.List;

@ApplicationScoped
public class ListActionsUseCase {

    public Result<ActionList> execute(RegisteredResource resource, ExecutionContext context) {
        List<ActionList.ActionInfo> actions = new ArrayList<>();
        actions.add(new ActionList.ActionInfo(
            RunActionUseCase.DELETE_SELECTED,
            "Delete selected " + resource.descriptor().verboseNamePlural()
        ));
        for (RecordAction action : resource.descriptor().actions()) {
            actions.add(new ActionList.ActionInfo(action.name(), action.description()));
        }
        return Result.success(new ActionList(resource.name(), actions.size(), actions));
    }
}
