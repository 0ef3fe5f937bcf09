package tech.flowcatalyst.resourcebridge.dispatch;

import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;

import java.util.Optional;

/**
 * Operations addressable as "&lt;operation&gt;_&lt;resource&gt;" and the action each requires.
 *
 * <p>Bulk has no fixed action; it depends on its sub-operation.
 */
public enum OperationType {

    LIST("list", PermissionAction.VIEW, "List %s with filtering, search, ordering and pagination"),
    GET("get", PermissionAction.VIEW, "Get a single %s by id"),
    CREATE("create", PermissionAction.ADD, "Create a new %s"),
    UPDATE("update", PermissionAction.CHANGE, "Update an existing %s and, optionally, its inline records"),
    DELETE("delete", PermissionAction.DELETE, "Delete a %s by id"),
    DESCRIBE("describe", PermissionAction.VIEW, "Describe the fields, relationships and admin settings of %s"),
    ACTIONS("actions", PermissionAction.VIEW, "List the actions available on %s"),
    ACTION("action", PermissionAction.CHANGE, "Run an action on selected %s"),
    BULK("bulk", null, "Create, update or delete many %s at once"),
    RELATED("related", PermissionAction.VIEW, "List records related to a %s"),
    HISTORY("history", PermissionAction.VIEW, "Show the change history of a %s"),
    AUTOCOMPLETE("autocomplete", PermissionAction.VIEW, "Suggest %s matching a search term");

    private final String code;
    private final PermissionAction requiredAction;
    private final String descriptionTemplate;

    OperationType(String code, PermissionAction requiredAction, String descriptionTemplate) {
        this.code = code;
        this.requiredAction = requiredAction;
        this.descriptionTemplate = descriptionTemplate;
    }

    public String code() {
        return code;
    }

    /**
     * Fixed action this operation requires, or null for {@link #BULK}.
     */
    public PermissionAction requiredAction() {
        return requiredAction;
    }

    public String describe(String subject) {
        return String.format(descriptionTemplate, subject);
    }

    public static Optional<OperationType> fromCode(String code) {
        for (OperationType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
