package tech.flowcatalyst.resourcebridge.common;

/**
 * Work executed inside a {@link UnitOfWork}.
 *
 * <p>Returning a failure rolls the transaction back just like throwing does.
 */
@FunctionalInterface
public interface TransactionalWork<T> {

    Result<T> run() throws Exception;
}
