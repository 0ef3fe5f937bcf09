package tech.flowcatalyst.resourcebridge.engine;

import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites column-style foreign key keys ("author_id") to the logical
 * relation name ("author").
 *
 * <p>A key is only rewritten when it is not itself a declared field and the
 * stripped name is a foreign key. When both forms are present the logical
 * name wins.
 */
public final class ForeignKeyNormalizer {

    static final String COLUMN_SUFFIX = "_id";

    private ForeignKeyNormalizer() {
    }

    public static Map<String, Object> normalize(ResourceDescriptor descriptor, Map<String, Object> data) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (data == null) {
            return normalized;
        }

        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey();
            String target = logicalName(descriptor, key).orElse(key);
            if (!target.equals(key) && data.containsKey(target)) {
                continue;
            }
            normalized.put(target, entry.getValue());
        }
        return normalized;
    }

    /**
     * The foreign key field a column-style key stands for, if any.
     */
    public static Optional<String> logicalName(ResourceDescriptor descriptor, String key) {
        if (!key.endsWith(COLUMN_SUFFIX) || descriptor.field(key).isPresent()) {
            return Optional.empty();
        }
        String base = key.substring(0, key.length() - COLUMN_SUFFIX.length());
        return descriptor.field(base)
            .filter(FieldDescriptor::isRelation)
            .map(FieldDescriptor::name);
    }
}
