package tech.flowcatalyst.resourcebridge.resource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Value types a resource field can declare.
 *
 * <p>Each type knows how to coerce a loosely typed argument value (as decoded
 * from JSON) into the canonical Java value stored in a record map.
 */
public enum FieldType {

    STRING("string"),
    TEXT("string"),
    EMAIL("string"),
    SLUG("string"),
    INTEGER("integer"),
    DECIMAL("number"),
    FLOAT("number"),
    BOOLEAN("boolean"),
    DATE("string"),
    DATETIME("string"),
    JSON("object"),
    FOREIGN_KEY("integer");

    private final String jsonType;

    FieldType(String jsonType) {
        this.jsonType = jsonType;
    }

    /**
     * JSON-Schema type name used in command input schemas.
     */
    public String jsonType() {
        return jsonType;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTextual() {
        return this == STRING || this == TEXT || this == EMAIL || this == SLUG;
    }

    /**
     * Coerce a raw value into this type's canonical representation.
     *
     * @throws IllegalArgumentException if the value cannot represent this type
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case STRING, TEXT, EMAIL, SLUG -> {
                if (value instanceof Map || value instanceof Collection) {
                    throw new IllegalArgumentException("Expected a string value");
                }
                return value.toString();
            }
            case INTEGER, FOREIGN_KEY -> {
                return toLong(value);
            }
            case DECIMAL -> {
                if (value instanceof BigDecimal) {
                    return value;
                }
                if (value instanceof Number || value instanceof String) {
                    return new BigDecimal(value.toString().trim());
                }
                throw new IllegalArgumentException("Expected a decimal value");
            }
            case FLOAT -> {
                if (value instanceof Number n) {
                    return n.doubleValue();
                }
                if (value instanceof String s) {
                    return Double.parseDouble(s.trim());
                }
                throw new IllegalArgumentException("Expected a numeric value");
            }
            case BOOLEAN -> {
                if (value instanceof Boolean) {
                    return value;
                }
                if (value instanceof String s) {
                    if ("true".equalsIgnoreCase(s)) {
                        return Boolean.TRUE;
                    }
                    if ("false".equalsIgnoreCase(s)) {
                        return Boolean.FALSE;
                    }
                }
                throw new IllegalArgumentException("Expected a boolean value");
            }
            case DATE -> {
                if (value instanceof LocalDate) {
                    return value;
                }
                try {
                    return LocalDate.parse(value.toString());
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Expected an ISO-8601 date", e);
                }
            }
            case DATETIME -> {
                return toInstant(value);
            }
            default -> {
                return value;
            }
        }
    }

    private static Long toLong(Object value) {
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new IllegalArgumentException("Expected an integer value");
            }
            return n.longValue();
        }
        if (value instanceof String s) {
            return Long.parseLong(s.trim());
        }
        throw new IllegalArgumentException("Expected an integer value");
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Instant i) {
            return i;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        String text = value.toString();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Expected an ISO-8601 timestamp", nested);
            }
        }
    }
}
