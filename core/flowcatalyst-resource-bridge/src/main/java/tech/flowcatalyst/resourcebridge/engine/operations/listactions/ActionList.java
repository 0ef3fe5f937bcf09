package tech.flowcatalyst.resourcebridge.engine.operations.listactions;

import java.util.List;

/**
 * Actions available on a resource, the built-in delete_selected first.
 */
public record ActionList(String model, int count, List<ActionInfo> actions) {

    public record ActionInfo(String name, String description) {}
}
