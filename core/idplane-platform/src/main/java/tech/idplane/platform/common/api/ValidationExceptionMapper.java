package tech.idplane.platform.common.api;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns Bean Validation failures on request bodies and parameters into 422 responses.
 */
@Provider
public class ValidationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        String errorMessage = exception.getConstraintViolations()
            .stream()
            .map(v -> lastNode(v) + " " + v.getMessage())
            .sorted()
            .collect(Collectors.joining(", "));

        return Response
            .status(ApiErrors.UNPROCESSABLE_ENTITY)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse("VALIDATION_FAILED", errorMessage,
                Map.of("violations", exception.getConstraintViolations().size())))
            .build();
    }

    private static String lastNode(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int dot = path.lastIndexOf('.');
        return dot >= 0 ? path.substring(dot + 1) : path;
    }
}
