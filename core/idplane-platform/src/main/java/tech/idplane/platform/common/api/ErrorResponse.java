package tech.idplane.platform.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    String message,
    Map<String, Object> details
) {

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }
}
