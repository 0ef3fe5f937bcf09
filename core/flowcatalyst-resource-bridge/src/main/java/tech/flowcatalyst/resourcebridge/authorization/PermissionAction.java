package tech.flowcatalyst.resourcebridge.authorization;

import java.util.Locale;
import java.util.Optional;

/**
 * Actions a principal can be granted on a resource.
 */
public enum PermissionAction {
    VIEW,
    ADD,
    CHANGE,
    DELETE;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve an action code such as "view". Returns empty for anything else.
     */
    public static Optional<PermissionAction> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (PermissionAction action : values()) {
            if (action.code().equals(code)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
