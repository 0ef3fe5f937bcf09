package tech.flowcatalyst.resourcebridge.testing;

import tech.flowcatalyst.resourcebridge.common.Result;
import tech.flowcatalyst.resourcebridge.common.errors.UseCaseError;

import static org.assertj.core.api.Assertions.*;

/**
 * Unwraps {@link Result}s in tests, failing with the error when the variant is wrong.
 */
public final class ResultAssertions {

    private ResultAssertions() {
    }

    public static <T> T assertSuccess(Result<T> result) {
        if (result instanceof Result.Failure<T> f) {
            fail("Expected success but got %s: %s", f.error().code(), f.error().message());
        }
        return ((Result.Success<T>) result).value();
    }

    public static UseCaseError assertFailure(Result<?> result) {
        assertThat(result).isInstanceOf(Result.Failure.class);
        return ((Result.Failure<?>) result).error();
    }
}
