package tech.idplane.platform.common;

import tech.idplane.platform.common.errors.UseCaseError;

/**
 * Result type for use case execution.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Successful results for mutations are produced by {@link UnitOfWork#commit},
 * so the audit entry is always written when local state changes. Use cases return
 * failures directly for validation problems, missing entities and remote errors.
 *
 * <p>Usage in API layer:
 * <pre>{@code
 * if (result instanceof Result.Failure<MyEvent> f) {
 *     return ApiErrors.toResponse(f.error());
 * }
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
