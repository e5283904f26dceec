package tech.idplane.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import tech.idplane.platform.common.errors.UseCaseError;

/**
 * Maps use case errors to HTTP responses.
 *
 * <ul>
 *   <li>AuthenticationError: 401</li>
 *   <li>NotFoundError: 404</li>
 *   <li>ConflictError: 409</li>
 *   <li>ValidationError: 422</li>
 *   <li>RemoteIntegrationError: 503</li>
 *   <li>anything else: 500</li>
 * </ul>
 */
public final class ApiErrors {

    public static final int UNPROCESSABLE_ENTITY = 422;

    private ApiErrors() {
    }

    public static Response toResponse(UseCaseError error) {
        return Response.status(statusOf(error))
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(error.code(), error.message(), error.details()))
            .build();
    }

    public static int statusOf(UseCaseError error) {
        if (error instanceof UseCaseError.AuthenticationError) {
            return Response.Status.UNAUTHORIZED.getStatusCode();
        }
        if (error instanceof UseCaseError.NotFoundError) {
            return Response.Status.NOT_FOUND.getStatusCode();
        }
        if (error instanceof UseCaseError.ConflictError) {
            return Response.Status.CONFLICT.getStatusCode();
        }
        if (error instanceof UseCaseError.ValidationError) {
            return UNPROCESSABLE_ENTITY;
        }
        if (error instanceof UseCaseError.RemoteIntegrationError) {
            return Response.Status.SERVICE_UNAVAILABLE.getStatusCode();
        }
        return Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
    }

    public static Response notFound(String code, String message) {
        return Response.status(Response.Status.NOT_FOUND)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(code, message))
            .build();
    }
}
