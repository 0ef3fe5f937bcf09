package tech.flowcatalyst.resourcebridge.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.ErrorCode;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;

import java.util.Map;

/**
 * Outcome of one dispatched command, handed back to the transport.
 *
 * <p>Either {@code success} with a payload, or an error message with its
 * {@link ErrorCode} and optional details.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
    boolean success,
    Object payload,
    String error,
    ErrorCode code,
    Map<String, Object> details
) {

    public static OperationResult success(Object payload) {
        return new OperationResult(true, payload, null, null, null);
    }

    public static OperationResult failure(UseCaseError error) {
        return new OperationResult(
            false,
            null,
            error.message(),
            error.code(),
            error.details() == null || error.details().isEmpty() ? null : error.details()
        );
    }

    public static OperationResult from(Result<?> result) {
        if (result instanceof Result.Failure<?> f) {
            return failure(f.error());
        }
        return success(((Result.Success<?>) result).value());
    }

    public boolean isFailure() {
        return !success;
    }
}
