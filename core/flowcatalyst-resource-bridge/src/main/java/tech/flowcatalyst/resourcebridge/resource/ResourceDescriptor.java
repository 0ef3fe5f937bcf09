package tech.flowcatalyst.resourcebridge.resource;

import tech.flowcatalyst.resourcebridge.authorization.PermissionAction;
import tech.flowcatalyst.resourcebridge.authorization.Principal;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Schema, admin configuration and permission policy of one resource type.
 *
 * <p>Implemented once per concrete resource. Only {@link #name()} and
 * {@link #fields()} are mandatory; everything else has an admin-style default.
 */
public interface ResourceDescriptor {

    /**
     * Registered name, lowercase, used in command identifiers (e.g., "author").
     */
    String name();

    /**
     * Ordered field metadata, primary key included.
     */
    List<FieldDescriptor> fields();

    default String verboseName() {
        return name().replace('_', ' ');
    }

    default String verboseNamePlural() {
        return verboseName() + "s";
    }

    default String appLabel() {
        return "default";
    }

    default Optional<FieldDescriptor> field(String fieldName) {
        for (FieldDescriptor field : fields()) {
            if (field.name().equals(fieldName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    default FieldDescriptor primaryKey() {
        for (FieldDescriptor field : fields()) {
            if (field.primaryKey()) {
                return field;
            }
        }
        throw new IllegalStateException("Resource " + name() + " declares no primary key");
    }

    /**
     * Fields matched by free-text search.
     */
    default List<String> searchableFields() {
        return List.of();
    }

    /**
     * Ordering used when a list request specifies none, "-field" for descending.
     */
    default List<String> defaultOrdering() {
        return List.of();
    }

    default List<String> listDisplay() {
        return List.of();
    }

    default List<String> listFilter() {
        return List.of();
    }

    /**
     * Fields that may be read but never written by callers.
     */
    default Set<String> readonlyFields() {
        return Set.of();
    }

    /**
     * Fields included in serialized records. Empty means all fields.
     */
    default List<String> visibleFields() {
        return List.of();
    }

    /**
     * Fields never included in serialized records, applied after {@link #visibleFields()}.
     */
    default Set<String> excludedFields() {
        return Set.of();
    }

    /**
     * Fields callers may see, filter, order, search or write: {@link #fields()}
     * less {@link #excludedFields()}.
     */
    default List<FieldDescriptor> exposedFields() {
        Set<String> excluded = excludedFields();
        if (excluded.isEmpty()) {
            return fields();
        }
        return fields().stream().filter(field -> !excluded.contains(field.name())).toList();
    }

    default Optional<FieldDescriptor> exposedField(String fieldName) {
        if (excludedFields().contains(fieldName)) {
            return Optional.empty();
        }
        return field(fieldName);
    }

    default List<String> exposedSearchFields() {
        Set<String> excluded = excludedFields();
        return searchableFields().stream().filter(name -> !excluded.contains(name)).toList();
    }

    default List<ChildDescriptor> childDescriptors() {
        return List.of();
    }

    default List<RelationDescriptor> relations() {
        return List.of();
    }

    default Optional<RelationDescriptor> relation(String relationName) {
        return relations().stream().filter(r -> r.name().equals(relationName)).findFirst();
    }

    /**
     * Custom actions. The built-in "delete_selected" is always available and
     * must not be declared here.
     */
    default List<RecordAction> actions() {
        return List.of();
    }

    /**
     * Display text of a record, used as audit object repr and autocomplete text.
     */
    default String displayText(Map<String, Object> record) {
        return verboseName() + " object (" + record.get(primaryKey().name()) + ")";
    }

    /**
     * Whether this resource restricts access at all. When false the permission
     * gate applies its undeclared-policy default.
     */
    default boolean declaresPermissionPolicy() {
        return true;
    }

    /**
     * Whether the principal may perform the action on this resource.
     * By default: the principal's effective permissions contain (name, action).
     */
    default boolean hasPermission(Principal principal, PermissionAction action) {
        return principal.hasPermission(name(), action);
    }
}
