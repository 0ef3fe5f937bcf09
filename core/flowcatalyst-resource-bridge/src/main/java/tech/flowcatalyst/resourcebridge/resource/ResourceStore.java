package tech.flowcatalyst.resourcebridge.resource;

import tech.flowcatalyst.resourcebridge.common.OffsetPage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence handle for one resource.
 *
 * <p>Records are maps keyed by logical field name, foreign keys holding the
 * target id. Implementations throw the store's own exceptions on failure
 * (constraint violations, connectivity); the engine maps them by their
 * SQLState, so those exceptions should keep the {@link java.sql.SQLException}
 * in their cause chain.
 *
 * <p>Mutations are expected to run inside a
 * {@link tech.flowcatalyst.resourcebridge.common.UnitOfWork}.
 */
public interface ResourceStore {

    Optional<Map<String, Object>> findById(Object id);

    /**
     * Records whose primary key is in the given ids, in primary key order.
     */
    List<Map<String, Object>> findByIds(Collection<?> ids);

    /**
     * Run a query. The page total counts every match regardless of offset and limit.
     */
    OffsetPage<Map<String, Object>> query(ResourceQuery query);

    /**
     * Insert a record and return its assigned primary key.
     */
    Object insert(Map<String, Object> values) throws Exception;

    /**
     * Apply the given field values to an existing record.
     */
    void update(Object id, Map<String, Object> values) throws Exception;

    void delete(Object id) throws Exception;

    /**
     * Records reachable through a named to-many relation.
     *
     * @throws IllegalArgumentException if the store does not know the relation
     */
    default OffsetPage<Map<String, Object>> findRelated(Object id, String relation, int offset, int limit) {
        throw new IllegalArgumentException("Unknown relation: " + relation);
    }
}
