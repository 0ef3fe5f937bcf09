package tech.flowcatalyst.resourcebridge.common;

/**
 * Unit of Work for atomic mutations.
 *
 * <p>Ensures that a record change and its audit log entry are committed
 * atomically. Every mutating use case goes through here, so an audit record
 * never outlives a rolled-back change and a change is never committed
 * without its audit record.
 *
 * <p>Usage in a use case:
 * <pre>{@code
 * return unitOfWork.execute(() -> {
 *     Object id = store.insert(values);
 *     auditService.record(ctx, resource, id, repr, AuditKind.ADDITION, "Created via MCP");
 *     return Result.success(id);
 * });
 * }</pre>
 *
 * <p>Bulk operations call {@link #execute} once per item so each item commits
 * or rolls back on its own.
 */
public interface UnitOfWork {

    /**
     * Run the work in a new transaction.
     *
     * <p>The transaction commits when the work returns a success. It rolls back
     * when the work returns a failure or throws; a thrown exception is mapped
     * to a {@link tech.flowcatalyst.resourcebridge.common.errors.UseCaseError}.
     *
     * @param work the work to run
     * @param <T>  the result value type
     * @return the work's result, or a failure describing why it rolled back
     */
    <T> Result<T> execute(TransactionalWork<T> work);

    /**
     * Run the work inside a savepoint of the current transaction.
     *
     * <p>On failure only the work since the savepoint is undone; the enclosing
     * transaction continues. Must be called from inside {@link #execute}.
     *
     * @param work the work to run
     * @param <T>  the result value type
     * @return the work's result, or a failure describing why it was undone
     */
    <T> Result<T> executeNested(TransactionalWork<T> work);
}
