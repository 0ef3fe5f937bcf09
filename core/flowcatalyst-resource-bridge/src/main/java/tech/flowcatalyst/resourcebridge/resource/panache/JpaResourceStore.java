package tech.flowcatalyst.resourcebridge.resource.panache;

import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import tech.flowcatalyst.resourcebridge.common.OffsetPage;
import tech.flowcatalyst.resourcebridge.resource.FieldFilter;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceQuery;
import tech.flowcatalyst.resourcebridge.resource.ResourceStore;
import tech.flowcatalyst.resourcebridge.resource.SortField;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ResourceStore} over a JPA entity, with queries built through the Criteria API.
 *
 * <p>Subclasses supply the entity class and the conversion between entity and
 * record map. Logical field names map to entity attributes through
 * {@link #attributePath(String)}; override it when they differ (for example
 * "author" stored as the association "author.id").
 *
 * <p>Every mutation flushes, so constraint violations are raised inside the
 * caller's unit of work rather than at commit.
 *
 * @param <E> the entity type
 */
public abstract class JpaResourceStore<E> implements ResourceStore {

    private static final char LIKE_ESCAPE = '\\';

    @Inject
    protected EntityManager em;

    protected abstract Class<E> entityClass();

    protected abstract ResourceDescriptor descriptor();

    /**
     * Record map keyed by logical field name. Foreign keys hold the target id.
     */
    protected abstract Map<String, Object> toRecord(E entity);

    protected abstract E newEntity();

    /**
     * Copy validated, coerced values onto the entity.
     */
    protected abstract void applyValues(E entity, Map<String, Object> values);

    protected abstract Object idOf(E entity);

    /**
     * Entity attribute path of a logical field, dot-separated for nested attributes.
     */
    protected String attributePath(String field) {
        return field;
    }

    /**
     * Convert an id argument to the entity's id type.
     */
    protected Object toEntityId(Object id) {
        return descriptor().primaryKey().coerce(id);
    }

    @Override
    public Optional<Map<String, Object>> findById(Object id) {
        E entity = em.find(entityClass(), toEntityId(id));
        return Optional.ofNullable(entity).map(this::toRecord);
    }

    @Override
    public List<Map<String, Object>> findByIds(Collection<?> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<Object> entityIds = new ArrayList<>();
        for (Object id : ids) {
            entityIds.add(toEntityId(id));
        }

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<E> cq = cb.createQuery(entityClass());
        Root<E> root = cq.from(entityClass());
        Path<Object> idPath = path(root, primaryKeyPath());
        cq.select(root).where(idPath.in(entityIds)).orderBy(cb.asc(idPath));

        return em.createQuery(cq).getResultList().stream().map(this::toRecord).toList();
    }

    @Override
    public OffsetPage<Map<String, Object>> query(ResourceQuery query) {
        CriteriaBuilder cb = em.getCriteriaBuilder();

        CriteriaQuery<E> cq = cb.createQuery(entityClass());
        Root<E> root = cq.from(entityClass());
        cq.select(root).where(predicates(cb, root, query).toArray(new Predicate[0]));
        cq.orderBy(orders(cb, root, query.ordering()));

        TypedQuery<E> typed = em.createQuery(cq).setFirstResult(query.offset());
        if (query.limit() != null) {
            typed.setMaxResults(query.limit());
        }
        List<Map<String, Object>> items = typed.getResultList().stream().map(this::toRecord).toList();

        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<E> countRoot = countQuery.from(entityClass());
        countQuery.select(cb.count(countRoot)).where(predicates(cb, countRoot, query).toArray(new Predicate[0]));
        long total = em.createQuery(countQuery).getSingleResult();

        return new OffsetPage<>(items, total, query.offset(), query.limit());
    }

    @Override
    public Object insert(Map<String, Object> values) {
        E entity = newEntity();
        applyValues(entity, values);
        em.persist(entity);
        em.flush();
        return idOf(entity);
    }

    @Override
    public void update(Object id, Map<String, Object> values) {
        E entity = require(id);
        applyValues(entity, values);
        em.flush();
    }

    @Override
    public void delete(Object id) {
        E entity = require(id);
        em.remove(entity);
        em.flush();
    }

    protected E require(Object id) {
        E entity = em.find(entityClass(), toEntityId(id));
        if (entity == null) {
            throw new EntityNotFoundException(descriptor().name() + " " + id + " does not exist");
        }
        return entity;
    }

    private String primaryKeyPath() {
        return attributePath(descriptor().primaryKey().name());
    }

    private List<Predicate> predicates(CriteriaBuilder cb, Root<E> root, ResourceQuery query) {
        List<Predicate> predicates = new ArrayList<>();
        for (FieldFilter filter : query.filters()) {
            predicates.add(toPredicate(cb, root, filter));
        }
        if (query.hasSearch()) {
            String pattern = "%" + escapeLike(query.searchTerm().toLowerCase(Locale.ROOT)) + "%";
            List<Predicate> anyField = new ArrayList<>();
            for (String field : query.searchFields()) {
                anyField.add(cb.like(lowerText(cb, root, field), pattern, LIKE_ESCAPE));
            }
            predicates.add(cb.or(anyField.toArray(new Predicate[0])));
        }
        return predicates;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Predicate toPredicate(CriteriaBuilder cb, Root<E> root, FieldFilter filter) {
        Path<Object> path = path(root, attributePath(filter.field()));
        Object value = filter.value();

        return switch (filter.lookup()) {
            case EXACT -> value == null ? cb.isNull(path) : cb.equal(path, value);
            case IEXACT -> cb.equal(lowerText(cb, root, filter.field()), lower(value));
            case CONTAINS -> cb.like(path.as(String.class), "%" + escapeLike(String.valueOf(value)) + "%", LIKE_ESCAPE);
            case ICONTAINS -> cb.like(lowerText(cb, root, filter.field()), "%" + escapeLike(lower(value)) + "%", LIKE_ESCAPE);
            case ISTARTSWITH -> cb.like(lowerText(cb, root, filter.field()), escapeLike(lower(value)) + "%", LIKE_ESCAPE);
            case GT -> cb.greaterThan((Expression<Comparable>) (Expression) path, (Comparable) value);
            case GTE -> cb.greaterThanOrEqualTo((Expression<Comparable>) (Expression) path, (Comparable) value);
            case LT -> cb.lessThan((Expression<Comparable>) (Expression) path, (Comparable) value);
            case LTE -> cb.lessThanOrEqualTo((Expression<Comparable>) (Expression) path, (Comparable) value);
            case IN -> ((Collection<?>) value).isEmpty() ? cb.disjunction() : path.in((Collection<?>) value);
            case ISNULL -> Boolean.TRUE.equals(value) ? cb.isNull(path) : cb.isNotNull(path);
        };
    }

    private List<Order> orders(CriteriaBuilder cb, Root<E> root, List<SortField> ordering) {
        List<Order> orders = new ArrayList<>();
        boolean orderedByKey = false;
        String keyField = descriptor().primaryKey().name();
        for (SortField sort : ordering) {
            Path<Object> path = path(root, attributePath(sort.field()));
            orders.add(sort.descending() ? cb.desc(path) : cb.asc(path));
            orderedByKey |= sort.field().equals(keyField);
        }
        if (!orderedByKey) {
            // Stable pagination
            orders.add(cb.asc(path(root, primaryKeyPath())));
        }
        return orders;
    }

    private Expression<String> lowerText(CriteriaBuilder cb, Root<E> root, String field) {
        return cb.lower(path(root, attributePath(field)).as(String.class));
    }

    private static Path<Object> path(Root<?> root, String attributePath) {
        Path<Object> path = null;
        for (String part : attributePath.split("\\.")) {
            path = path == null ? root.get(part) : path.get(part);
        }
        return path;
    }

    private static String lower(Object value) {
        return String.valueOf(value).toLowerCase(Locale.ROOT);
    }

    private static String escapeLike(String value) {
        return value
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }
}
