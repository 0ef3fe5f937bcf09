package tech.flowcatalyst.resourcebridge.common.errors;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of error codes returned to callers.
 *
 * <p>Every failure leaving the dispatcher carries exactly one of these codes.
 * Storage driver messages are never returned, only the code and a generic message.
 */
public enum ErrorCode {

    NOT_FOUND("not_found"),
    PERMISSION_DENIED("permission_denied"),
    VALIDATION_ERROR("validation_error"),
    DUPLICATE_ENTRY("duplicate_entry"),
    INVALID_REFERENCE("invalid_reference"),
    CONSTRAINT_ERROR("constraint_error"),
    DATABASE_UNAVAILABLE("database_unavailable"),
    INVALID_INPUT("invalid_input"),
    INVALID_FIELD("invalid_field"),
    INTERNAL_ERROR("internal_error");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
