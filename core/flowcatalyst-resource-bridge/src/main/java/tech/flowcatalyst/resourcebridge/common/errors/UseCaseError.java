package tech.flowcatalyst.resourcebridge.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type; the {@link ErrorCode} is the stable
 * wire-level classification handed to the transport.
 */
public sealed interface UseCaseError {

    ErrorCode code();
    String message();
    Map<String, Object> details();

    /**
     * Request shape or field validation failed.
     * Codes: validation_error, invalid_field, invalid_input.
     */
    record ValidationError(
        ErrorCode code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Resource, record, action or relation not found.
     */
    record NotFoundError(
        ErrorCode code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Principal not allowed to perform the action.
     * Details carry exactly the denied action and resource.
     */
    record AuthorizationError(
        ErrorCode code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * A storage constraint rejected the change.
     * Codes: duplicate_entry, invalid_reference, constraint_error.
     */
    record ConflictError(
        ErrorCode code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * The store failed or was unreachable.
     * Codes: database_unavailable, internal_error.
     */
    record StorageError(
        ErrorCode code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    // ========================================================================
    // Factories
    // ========================================================================

    static ValidationError validation(String message) {
        return new ValidationError(ErrorCode.VALIDATION_ERROR, message, Map.of());
    }

    static ValidationError validation(String message, Map<String, Object> details) {
        return new ValidationError(ErrorCode.VALIDATION_ERROR, message, details);
    }

    static ValidationError invalidField(String field) {
        return new ValidationError(ErrorCode.INVALID_FIELD, "Invalid field: " + field, Map.of("field", field));
    }

    static ValidationError invalidInput(String message) {
        return new ValidationError(ErrorCode.INVALID_INPUT, message, Map.of());
    }

    static NotFoundError notFound(String message) {
        return new NotFoundError(ErrorCode.NOT_FOUND, message, Map.of());
    }

    static AuthorizationError permissionDenied(String action, String resource) {
        return new AuthorizationError(
            ErrorCode.PERMISSION_DENIED,
            "Permission denied: cannot " + action + " " + resource,
            Map.of("action", action, "resource", resource)
        );
    }
}
