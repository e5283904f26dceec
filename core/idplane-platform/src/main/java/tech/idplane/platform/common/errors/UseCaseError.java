package tech.idplane.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping
 * and client-side handling.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (missing required fields, values outside an allowed set, etc.)
     * Maps to HTTP 422 Unprocessable Entity.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * A unique key is already taken (duplicate client_id, role name, scope name).
     * Maps to HTTP 409 Conflict.
     */
    record ConflictError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Entity or association not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Credentials were rejected or the account may not sign in.
     * Maps to HTTP 401 Unauthorized.
     */
    record AuthenticationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * The authorization server could not be reached or answered with an error.
     * Details always carry the HTTP status and body returned by the remote side.
     * Maps to HTTP 503 Service Unavailable.
     */
    record RemoteIntegrationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * The local transaction could not be committed for a reason other than a unique key.
     * Maps to HTTP 500.
     */
    record CommitError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
