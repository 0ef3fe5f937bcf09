package tech.flowcatalyst.resourcebridge.authorization;

import java.util.Objects;

/**
 * A grant of one action on one resource.
 *
 * @param resource resource name, as registered (e.g., "author")
 * @param action   the granted action
 */
public record Permission(String resource, PermissionAction action) {

    public Permission {
        Objects.requireNonNull(resource, "resource must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    public static Permission of(String resource, PermissionAction action) {
        return new Permission(resource, action);
    }

    /**
     * Parse the stored "resource:action" form.
     *
     * @throws IllegalArgumentException if the value is not in that form
     */
    public static Permission parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Permission value cannot be null");
        }
        int separator = value.lastIndexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Invalid permission format: " + value);
        }
        String action = value.substring(separator + 1);
        return new Permission(
            value.substring(0, separator),
            PermissionAction.fromCode(action)
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission action: " + action))
        );
    }

    public String toStorageString() {
        return resource + ":" + action.code();
    }

    @Override
    public String toString() {
        return toStorageString();
    }
}
