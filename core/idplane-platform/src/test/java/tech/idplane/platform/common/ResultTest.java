package tech.idplane.platform.common;

import org.junit.jupiter.api.Test;
import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ResultTest {

    @Test
    void success_shouldCarryValue() {
        Result<String> result = Result.success("done");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(((Result.Success<String>) result).value()).isEqualTo("done");
    }

    @Test
    void failure_shouldCarryError() {
        UseCaseError error = new UseCaseError.NotFoundError("ROLE_NOT_FOUND", "Role not found", Map.of());

        Result<String> result = Result.failure(error);

        assertThat(result.isFailure()).isTrue();
        assertThat(result).isInstanceOf(Result.Failure.class);
        assertThat(((Result.Failure<String>) result).error()).isSameAs(error);
    }

    @Test
    void failure_shouldBeReturnableUnderAnotherValueType() {
        Result<String> original = Result.failure(new UseCaseError.ValidationError("BAD", "bad", Map.of()));

        Result<Integer> retyped = original instanceof Result.Failure<String> f ? Result.failure(f.error()) : null;

        assertThat(retyped).isNotNull();
        assertThat(((Result.Failure<Integer>) retyped).error().code()).isEqualTo("BAD");
    }
}
