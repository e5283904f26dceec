package tech.idplane.serviceaccount.operations;

import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Not-found errors shared by the service account use cases.
 */
public final class ServiceAccountErrors {

    private ServiceAccountErrors() {
    }

    public static UseCaseError accountNotFound(String serviceAccountId) {
        return new UseCaseError.NotFoundError(
            "SERVICE_ACCOUNT_NOT_FOUND",
            "Service account not found",
            Map.of("serviceAccountId", String.valueOf(serviceAccountId))
        );
    }

    public static UseCaseError roleNotFound(String roleId) {
        return new UseCaseError.NotFoundError(
            "ROLE_NOT_FOUND",
            "Role not found: " + roleId,
            Map.of("roleId", String.valueOf(roleId))
        );
    }

    public static UseCaseError scopeNotFound(String scopeId) {
        return new UseCaseError.NotFoundError(
            "SCOPE_NOT_FOUND",
            "Scope not found: " + scopeId,
            Map.of("scopeId", String.valueOf(scopeId))
        );
    }
}
