package tech.flowcatalyst.resourcebridge.common.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.SystemException;
import jakarta.transaction.TransactionManager;
import jakarta.transaction.Transactional;
import org.hibernate.Session;
import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.TransactionalWork;
import tech.flowcatalyst.resourcebridge.common.UnitOfWork;
import tech.flowcatalyst.resourcebridge.common.errors.ExceptionTranslator;

import java.sql.Connection;
import java.sql.Savepoint;

/**
 * JPA implementation of {@link UnitOfWork} using JTA transactions.
 *
 * <p>{@link #execute} always starts a new transaction, so bulk items never
 * share one. The persistence context is flushed before returning so that
 * constraint violations surface inside the work, where they can be
 * translated, instead of at commit.
 *
 * <p>{@link #executeNested} uses a JDBC savepoint on the current connection.
 */
@ApplicationScoped
public class PanacheTransactionalUnitOfWork implements UnitOfWork {

    private static final Logger LOG = Logger.getLogger(PanacheTransactionalUnitOfWork.class);

    @Inject
    EntityManager em;

    @Inject
    TransactionManager transactionManager;

    @Override
    @Transactional(Transactional.TxType.REQUIRES_NEW)
    public <T> Result<T> execute(TransactionalWork<T> work) {
        try {
            Result<T> result = work.run();
            if (result.isFailure()) {
                markRollbackOnly();
                return result;
            }
            em.flush();
            return result;

        } catch (Exception e) {
            markRollbackOnly();
            return Result.failure(ExceptionTranslator.translate(e, "transaction"));
        }
    }

    @Override
    @Transactional(Transactional.TxType.MANDATORY)
    public <T> Result<T> executeNested(TransactionalWork<T> work) {
        Session session = em.unwrap(Session.class);
        session.flush();
        Savepoint savepoint = session.doReturningWork(Connection::setSavepoint);

        try {
            Result<T> result = work.run();
            if (result.isFailure()) {
                rollbackTo(session, savepoint);
                return result;
            }
            session.flush();
            session.doWork(connection -> connection.releaseSavepoint(savepoint));
            return result;

        } catch (Exception e) {
            rollbackTo(session, savepoint);
            return Result.failure(ExceptionTranslator.translate(e, "nested operation"));
        }
    }

    private void rollbackTo(Session session, Savepoint savepoint) {
        // Pending actions of the failed work must not be flushed later
        session.clear();
        session.doWork(connection -> connection.rollback(savepoint));
        LOG.debug("Rolled back to savepoint");
    }

    private void markRollbackOnly() {
        try {
            transactionManager.setRollbackOnly();
        } catch (IllegalStateException | SystemException e) {
            LOG.warnf(e, "Failed to mark transaction rollback-only");
        }
    }
}
