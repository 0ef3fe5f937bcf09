package tech.flowcatalyst.resourcebridge.engine;

import org.jboss.logging.Logger;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.FieldFilter;
import tech.flowcatalyst.resourcebridge.resource.FieldType;
import tech.flowcatalyst.resourcebridge.resource.FilterLookup;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceQuery;
import tech.flowcatalyst.resourcebridge.resource.SortField;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link ResourceQuery} from list arguments.
 *
 * <p>Filter keys are "field" or "field__lookup". Keys naming an unknown or
 * excluded field, or an unknown lookup, are dropped, as are ordering terms
 * outside the exposed field set. Excluded fields are never searched. A value
 * that cannot be coerced to the field's type raises
 * {@link IllegalArgumentException}.
 */
public final class QueryTranslator {

    private static final Logger LOG = Logger.getLogger(QueryTranslator.class);

    static final String LOOKUP_SEPARATOR = "__";

    private QueryTranslator() {
    }

    public static ResourceQuery translate(
            ResourceDescriptor descriptor,
            Map<String, Object> filters,
            String search,
            List<String> orderBy,
            int offset,
            Integer limit
    ) {
        List<String> requested = orderBy == null || orderBy.isEmpty() ? descriptor.defaultOrdering() : orderBy;
        return new ResourceQuery(
            filters(descriptor, filters),
            search,
            descriptor.exposedSearchFields(),
            ordering(descriptor, requested),
            offset,
            limit
        );
    }

    public static List<FieldFilter> filters(ResourceDescriptor descriptor, Map<String, Object> filters) {
        List<FieldFilter> result = new ArrayList<>();
        if (filters == null) {
            return result;
        }
        for (Map.Entry<String, Object> entry : filters.entrySet()) {
            toFilter(descriptor, entry.getKey(), entry.getValue()).ifPresent(result::add);
        }
        return result;
    }

    public static List<SortField> ordering(ResourceDescriptor descriptor, List<String> terms) {
        Set<String> valid = validOrderingTerms(descriptor);
        List<SortField> result = new ArrayList<>();
        if (terms == null) {
            return result;
        }
        for (String term : terms) {
            if (term != null && valid.contains(term)) {
                result.add(SortField.parse(term));
            } else {
                LOG.debugf("Dropping invalid ordering [%s] for %s", term, descriptor.name());
            }
        }
        return result;
    }

    static Set<String> validOrderingTerms(ResourceDescriptor descriptor) {
        Set<String> valid = new HashSet<>();
        for (FieldDescriptor field : descriptor.exposedFields()) {
            valid.add(field.name());
            valid.add("-" + field.name());
        }
        return valid;
    }

    private static Optional<FieldFilter> toFilter(ResourceDescriptor descriptor, String key, Object value) {
        String fieldName = key;
        FilterLookup lookup = FilterLookup.EXACT;

        int separator = key.lastIndexOf(LOOKUP_SEPARATOR);
        if (separator > 0) {
            Optional<FilterLookup> parsed = FilterLookup.fromCode(key.substring(separator + LOOKUP_SEPARATOR.length()));
            if (parsed.isEmpty()) {
                LOG.debugf("Dropping filter [%s] on %s: unknown lookup", key, descriptor.name());
                return Optional.empty();
            }
            fieldName = key.substring(0, separator);
            lookup = parsed.get();
        }

        Optional<FieldDescriptor> field = descriptor.exposedField(fieldName);
        if (field.isEmpty()) {
            field = ForeignKeyNormalizer.logicalName(descriptor, fieldName).flatMap(descriptor::exposedField);
        }
        if (field.isEmpty()) {
            LOG.debugf("Dropping filter [%s] on %s: unknown field", key, descriptor.name());
            return Optional.empty();
        }

        return Optional.of(new FieldFilter(field.get().name(), lookup, coerce(field.get(), lookup, value)));
    }

    private static Object coerce(FieldDescriptor field, FilterLookup lookup, Object value) {
        switch (lookup) {
            case ISNULL -> {
                Object flag = FieldType.BOOLEAN.coerce(value);
                if (flag == null) {
                    throw new IllegalArgumentException("isnull requires true or false");
                }
                return flag;
            }
            case IEXACT, CONTAINS, ICONTAINS, ISTARTSWITH -> {
                if (value == null) {
                    throw new IllegalArgumentException(lookup.code() + " requires a value");
                }
                return String.valueOf(value);
            }
            case IN -> {
                List<Object> values = new ArrayList<>();
                for (Object item : asCollection(value)) {
                    values.add(field.coerce(item));
                }
                return values;
            }
            default -> {
                if (value == null && lookup != FilterLookup.EXACT) {
                    throw new IllegalArgumentException(lookup.code() + " requires a value");
                }
                return field.coerce(value);
            }
        }
    }

    private static Collection<?> asCollection(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection;
        }
        if (value instanceof String text) {
            List<String> parts = new ArrayList<>();
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    parts.add(part.trim());
                }
            }
            return parts;
        }
        if (value == null) {
            return List.of();
        }
        return List.of(value);
    }
}
