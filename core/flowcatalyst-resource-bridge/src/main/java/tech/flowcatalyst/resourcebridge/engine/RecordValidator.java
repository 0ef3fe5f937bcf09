package tech.flowcatalyst.resourcebridge.engine;

import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.resource.FieldChoice;
import tech.flowcatalyst.resourcebridge.resource.FieldDescriptor;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates record data against a descriptor's writable field set.
 *
 * <p>Checks run in a fixed order and stop at the first failing stage:
 * <ol>
 *   <li>every key is a declared field (foreign key aliases already normalized): invalid_field</li>
 *   <li>no key is read-only or non-editable: validation_error with readonly_fields</li>
 *   <li>per-field checks (required, null, type, length, choices), all collected into
 *       validation_errors</li>
 * </ol>
 * On success the values are coerced to their canonical types.
 */
public final class RecordValidator {

    public static final String VALIDATION_ERRORS = "validation_errors";
    public static final String READONLY_FIELDS = "readonly_fields";

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern SLUG = Pattern.compile("^[-a-zA-Z0-9_]+$");

    private RecordValidator() {
    }

    /**
     * Validate data for a new record. Missing fields with defaults are filled in.
     */
    public static Result<Map<String, Object>> validateCreate(ResourceDescriptor descriptor, Map<String, Object> data) {
        Map<String, Object> normalized = ForeignKeyNormalizer.normalize(descriptor, data);

        Result<Void> shape = checkShape(descriptor, normalized, "Cannot set readonly fields: ");
        if (shape instanceof Result.Failure<Void> failure) {
            return failure.cast();
        }

        Map<String, List<String>> errors = new LinkedHashMap<>();
        Map<String, Object> cleaned = new LinkedHashMap<>();
        for (FieldDescriptor field : descriptor.fields()) {
            if (!isWritable(descriptor, field)) {
                continue;
            }
            if (!normalized.containsKey(field.name())) {
                if (field.defaultValue() != null) {
                    cleaned.put(field.name(), field.defaultValue());
                } else if (field.required()) {
                    addError(errors, field.name(), "This field is required.");
                }
                continue;
            }
            checkValue(field, normalized.get(field.name()), cleaned, errors);
        }

        return finish(cleaned, errors);
    }

    /**
     * Validate a partial update. Only the given keys are checked.
     */
    public static Result<Map<String, Object>> validateUpdate(ResourceDescriptor descriptor, Map<String, Object> data) {
        Map<String, Object> normalized = ForeignKeyNormalizer.normalize(descriptor, data);

        Result<Void> shape = checkShape(descriptor, normalized, "Cannot update readonly fields: ");
        if (shape instanceof Result.Failure<Void> failure) {
            return failure.cast();
        }

        Map<String, List<String>> errors = new LinkedHashMap<>();
        Map<String, Object> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : normalized.entrySet()) {
            FieldDescriptor field = descriptor.field(entry.getKey()).orElseThrow();
            checkValue(field, entry.getValue(), cleaned, errors);
        }

        return finish(cleaned, errors);
    }

    private static Result<Void> checkShape(ResourceDescriptor descriptor, Map<String, Object> data, String readonlyMessage) {
        for (String key : data.keySet()) {
            if (descriptor.exposedField(key).isEmpty()) {
                return Result.failure(UseCaseError.invalidField(key));
            }
        }

        Set<String> readonly = new LinkedHashSet<>();
        for (String key : data.keySet()) {
            FieldDescriptor field = descriptor.field(key).orElseThrow();
            if (!isWritable(descriptor, field)) {
                readonly.add(key);
            }
        }
        if (!readonly.isEmpty()) {
            return Result.failure(UseCaseError.validation(
                readonlyMessage + String.join(", ", readonly),
                Map.of(READONLY_FIELDS, List.copyOf(readonly))
            ));
        }
        return Result.success(null);
    }

    private static boolean isWritable(ResourceDescriptor descriptor, FieldDescriptor field) {
        return field.editable()
            && !descriptor.readonlyFields().contains(field.name())
            && !descriptor.excludedFields().contains(field.name());
    }

    private static void checkValue(FieldDescriptor field, Object raw, Map<String, Object> cleaned,
                                   Map<String, List<String>> errors) {
        if (raw == null) {
            if (!field.nullable()) {
                addError(errors, field.name(), "This field cannot be null.");
                return;
            }
            cleaned.put(field.name(), null);
            return;
        }

        Object value;
        try {
            value = field.coerce(raw);
        } catch (IllegalArgumentException e) {
            addError(errors, field.name(), "Enter a valid " + field.type().code().replace('_', ' ') + " value.");
            return;
        }

        if (value instanceof String text) {
            if (text.isEmpty() && !field.blank()) {
                addError(errors, field.name(), "This field cannot be blank.");
                return;
            }
            if (field.maxLength() != null && text.length() > field.maxLength()) {
                addError(errors, field.name(), "Ensure this value has at most " + field.maxLength()
                    + " characters (it has " + text.length() + ").");
            }
            if (!text.isEmpty()) {
                switch (field.type()) {
                    case EMAIL -> {
                        if (!EMAIL.matcher(text).matches()) {
                            addError(errors, field.name(), "Enter a valid email address.");
                        }
                    }
                    case SLUG -> {
                        if (!SLUG.matcher(text).matches()) {
                            addError(errors, field.name(), "Enter a valid slug.");
                        }
                    }
                }
            }
        }

        if (!field.choices().isEmpty() && !isChoice(field, value)) {
            addError(errors, field.name(), "Value '" + raw + "' is not a valid choice.");
        }

        cleaned.put(field.name(), value);
    }

    private static boolean isChoice(FieldDescriptor field, Object value) {
        for (FieldChoice choice : field.choices()) {
            Object allowed = choice.value();
            // Integer choices against Long values compare by text
            if (Objects.equals(allowed, value) || String.valueOf(allowed).equals(String.valueOf(value))) {
                return true;
            }
        }
        return false;
    }

    private static Result<Map<String, Object>> finish(Map<String, Object> cleaned, Map<String, List<String>> errors) {
        if (!errors.isEmpty()) {
            return Result.failure(UseCaseError.validation(
                "Validation failed",
                Map.of(VALIDATION_ERRORS, errors)
            ));
        }
        return Result.success(cleaned);
    }

    private static void addError(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }
}
