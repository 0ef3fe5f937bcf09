package tech.flowcatalyst.resourcebridge.engine.operations.runaction;

import java.util.List;

/**
 * Command to run a named action over selected records.
 *
 * @param action action name, "delete_selected" for the built-in delete
 * @param ids    primary keys of the selected records
 */
public record RunActionCommand(String action, List<Object> ids) {}
