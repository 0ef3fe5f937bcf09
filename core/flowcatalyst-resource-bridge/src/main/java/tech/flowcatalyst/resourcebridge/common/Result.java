package tech.flowcatalyst.resourcebridge.common;

import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;

/**
 * Result type for use case execution.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Mutating use cases return success through {@link UnitOfWork#execute}, so the
 * store change and its audit record are committed together or not at all.
 *
 * <p>Usage in the dispatcher:
 * <pre>{@code
 * if (result instanceof Result.Failure<?> f) {
 *     return OperationResult.failure(f.error());
 * }
 * return OperationResult.success(((Result.Success<?>) result).value());
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        /**
         * Re-type a failure so it can be returned from a use case with a different value type.
         */
        public <R> Result<R> cast() {
            return new Failure<>(error);
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
