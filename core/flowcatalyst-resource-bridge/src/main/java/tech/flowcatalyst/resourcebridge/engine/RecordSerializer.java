package tech.flowcatalyst.resourcebridge.engine;

import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders stored records for callers, applying the descriptor's field visibility.
 *
 * <p>The primary key is always included. With an include list only those
 * fields follow, in that order; otherwise every field in declaration order.
 * Excluded fields are removed last, so secrets stay hidden even when listed.
 */
public final class RecordSerializer {

    private RecordSerializer() {
    }

    public static Map<String, Object> serialize(ResourceDescriptor descriptor, Map<String, Object> record) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (record == null) {
            return result;
        }
        Set<String> excluded = descriptor.excludedFields();
        for (String field : visibleFieldNames(descriptor)) {
            if (!excluded.contains(field) && record.containsKey(field)) {
                result.put(field, record.get(field));
            }
        }
        return result;
    }

    public static List<Map<String, Object>> serializeAll(ResourceDescriptor descriptor, List<Map<String, Object>> records) {
        List<Map<String, Object>> result = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            result.add(serialize(descriptor, record));
        }
        return result;
    }

    static List<String> visibleFieldNames(ResourceDescriptor descriptor) {
        String primaryKey = descriptor.primaryKey().name();
        List<String> names = new ArrayList<>();
        names.add(primaryKey);

        List<String> visible = descriptor.visibleFields();
        if (visible.isEmpty()) {
            for (FieldDescriptor field : descriptor.fields()) {
                if (!field.name().equals(primaryKey)) {
                    names.add(field.name());
                }
            }
        } else {
            for (String name : visible) {
                if (!name.equals(primaryKey) && descriptor.field(name).isPresent()) {
                    names.add(name);
                }
            }
        }
        return names;
    }
}
