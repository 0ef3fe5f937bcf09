package tech.flowcatalyst.resourcebridge.engine;

import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;
import tech.flowcatalyst.resourcebridge.resource.ResourceDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Coerces caller-supplied ids to the primary key type of a resource.
 */
public final class RecordIds {

    public static final String ID_REQUIRED = "id parameter is required";

    private RecordIds() {
    }

    public static boolean isMissing(Object raw) {
        return raw == null || (raw instanceof String s && s.isBlank());
    }

    public static Result<Object> coerce(ResourceDescriptor descriptor, Object raw) {
        if (isMissing(raw)) {
            return Result.failure(UseCaseError.validation(ID_REQUIRED));
        }
        try {
            return Result.success(descriptor.primaryKey().coerce(raw));
        } catch (IllegalArgumentException e) {
            return Result.failure(UseCaseError.invalidInput("Invalid id: " + raw));
        }
    }

    public static Result<List<Object>> coerceAll(ResourceDescriptor descriptor, Collection<?> raw) {
        List<Object> ids = new ArrayList<>();
        for (Object item : raw) {
            Result<Object> id = coerce(descriptor, item);
            if (id instanceof Result.Failure<Object> f) {
                return f.cast();
            }
            ids.add(((Result.Success<Object>) id).value());
        }
        return Result.success(ids);
    }
}
