package tech.flowcatalyst.resourcebridge.engine.operations.bulkmutate;

import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;

import java.util.Optional;

/**
 * Sub-operation of a bulk command and the permission it requires.
 */
public enum BulkOperation {

    CREATE("create", PermissionAction.ADD),
    UPDATE("update", PermissionAction.CHANGE),
    DELETE("delete", PermissionAction.DELETE);

    public static final String REQUIRED_MESSAGE = "operation parameter is required";
    public static final String INVALID_MESSAGE = "operation must be 'create', 'update', or 'delete'";

    private final String code;
    private final PermissionAction requiredAction;

    BulkOperation(String code, PermissionAction requiredAction) {
        this.code = code;
        this.requiredAction = requiredAction;
    }

    public String code() {
        return code;
    }

    public PermissionAction requiredAction() {
        return requiredAction;
    }

    public static Optional<BulkOperation> fromCode(String code) {
        for (BulkOperation operation : values()) {
            if (operation.code.equals(code)) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
