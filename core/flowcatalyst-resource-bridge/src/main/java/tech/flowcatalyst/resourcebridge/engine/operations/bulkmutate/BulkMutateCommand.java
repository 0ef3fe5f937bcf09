package tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate;

import java.util.List;

/**
 * Command to apply one operation to many items.
 *
 * @param operation the sub-operation
 * @param items     field maps for create, {@code {id, data}} maps for update,
 *                  ids for delete
 */
public record BulkMutateCommand(BulkOperation operation, List<Object> items) {

    public BulkMutateCommand {
        items = items != null ? items : List.of();
    }
}
