package tech.idplane.user.operations;

import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Errors shared by the user use cases.
 */
public final class UserErrors {

    private UserErrors() {
    }

    public static UseCaseError userNotFound(String userId) {
        return new UseCaseError.NotFoundError(
            "USER_NOT_FOUND",
            "User not found",
            Map.of("userId", String.valueOf(userId))
        );
    }

    public static UseCaseError roleNotFound(String roleId) {
        return new UseCaseError.NotFoundError(
            "ROLE_NOT_FOUND",
            "Role not found: " + roleId,
            Map.of("roleId", String.valueOf(roleId))
        );
    }

    public static UseCaseError emailExists(String email) {
        return new UseCaseError.ConflictError(
            "EMAIL_EXISTS",
            "A user with email '" + email + "' already exists",
            Map.of("email", email)
        );
    }

    public static UseCaseError invalidPassword(String reason) {
        return new UseCaseError.ValidationError("INVALID_PASSWORD", reason, Map.of());
    }
}
