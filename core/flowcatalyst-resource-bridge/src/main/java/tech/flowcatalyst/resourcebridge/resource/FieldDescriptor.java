package tech.flowcatalyst.resourcebridge.resource;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed metadata for one field of a resource.
 *
 * <p>Use the builder:
 * <pre>{@code
 * FieldDescriptor.builder("email", FieldType.EMAIL).maxLength(254).unique().build();
 * FieldDescriptor.foreignKey("author", "author").build();
 * }</pre>
 *
 * @param name           logical field name, also the key in record maps
 * @param type           value type
 * @param verboseName    human-readable label
 * @param nullable       whether null may be stored
 * @param blank          whether the field may be omitted on create
 * @param maxLength      maximum length for textual fields, or null
 * @param unique         whether the store enforces uniqueness
 * @param defaultValue   value applied when omitted on create, or null
 * @param choices        allowed values, empty when unrestricted
 * @param relatedResource target resource name for foreign keys, or null
 * @param relatedIdType  id type of the target resource for foreign keys
 * @param primaryKey     whether this is the primary key
 * @param editable       whether callers may write this field at all
 * @param helpText       optional description
 */
public record FieldDescriptor(
    String name,
    FieldType type,
    String verboseName,
    boolean nullable,
    boolean blank,
    Integer maxLength,
    boolean unique,
    Object defaultValue,
    List<FieldChoice> choices,
    String relatedResource,
    FieldType relatedIdType,
    boolean primaryKey,
    boolean editable,
    String helpText
) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        choices = choices != null ? List.copyOf(choices) : List.of();
    }

    /**
     * A field is required on create when it cannot be null, may not be left
     * blank and has no default. Primary keys are assigned by the store.
     */
    public boolean required() {
        return !primaryKey && !nullable && !blank && defaultValue == null;
    }

    public boolean isRelation() {
        return type == FieldType.FOREIGN_KEY;
    }

    /**
     * Column-style alias of a foreign key ("author" becomes "author_id").
     * Equal to the name for every other field.
     */
    public String columnName() {
        return isRelation() ? name + "_id" : name;
    }

    /**
     * Coerce a raw argument value into this field's canonical representation.
     *
     * @throws IllegalArgumentException if the value does not fit the type
     */
    public Object coerce(Object value) {
        if (isRelation()) {
            return (relatedIdType != null ? relatedIdType : FieldType.INTEGER).coerce(value);
        }
        return type.coerce(value);
    }

    public String jsonType() {
        if (isRelation()) {
            return (relatedIdType != null ? relatedIdType : FieldType.INTEGER).jsonType();
        }
        return type.jsonType();
    }

    public static Builder builder(String name, FieldType type) {
        return new Builder(name, type);
    }

    public static Builder foreignKey(String name, String relatedResource) {
        return new Builder(name, FieldType.FOREIGN_KEY).relatedResource(relatedResource);
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private String verboseName;
        private boolean nullable;
        private boolean blank;
        private Integer maxLength;
        private boolean unique;
        private Object defaultValue;
        private final List<FieldChoice> choices = new ArrayList<>();
        private String relatedResource;
        private FieldType relatedIdType = FieldType.INTEGER;
        private boolean primaryKey;
        private boolean editable = true;
        private String helpText;

        private Builder(String name, FieldType type) {
            this.name = name;
            this.type = type;
        }

        public Builder verboseName(String verboseName) {
            this.verboseName = verboseName;
            return this;
        }

        /**
         * Allow null and allow omission on create.
         */
        public Builder optional() {
            this.nullable = true;
            this.blank = true;
            return this;
        }

        public Builder blank() {
            this.blank = true;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder unique() {
            this.unique = true;
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder choice(Object value, String label) {
            this.choices.add(FieldChoice.of(value, label));
            return this;
        }

        public Builder relatedResource(String relatedResource) {
            this.relatedResource = relatedResource;
            return this;
        }

        public Builder relatedIdType(FieldType relatedIdType) {
            this.relatedIdType = relatedIdType;
            return this;
        }

        /**
         * Mark as primary key. Primary keys are store-assigned and never writable.
         */
        public Builder primaryKey() {
            this.primaryKey = true;
            this.editable = false;
            this.blank = true;
            return this;
        }

        public Builder readOnly() {
            this.editable = false;
            return this;
        }

        public Builder helpText(String helpText) {
            this.helpText = helpText;
            return this;
        }

        public FieldDescriptor build() {
            return new FieldDescriptor(
                name,
                type,
                verboseName != null ? verboseName : name.replace('_', ' '),
                nullable,
                blank,
                maxLength,
                unique,
                defaultValue,
                choices,
                relatedResource,
                type == FieldType.FOREIGN_KEY ? relatedIdType : null,
                primaryKey,
                editable,
                helpText
            );
        }
    }
}
