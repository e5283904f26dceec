package tech.idplane.platform.idp;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised for any failed call to the authorization server admin API.
 *
 * <p>Carries the HTTP status and response body of the failing call. Transport
 * failures (timeout, DNS, connection refused) use status code 0.
 */
public class IdpIntegrationException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public IdpIntegrationException(String message, int statusCode, String responseBody) {
        this(message, statusCode, responseBody, null);
    }

    public IdpIntegrationException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    public IdpIntegrationException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isTransportFailure() {
        return statusCode == 0;
    }

    /**
     * Diagnostic details suitable for an error response body.
     */
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", statusCode);
        if (responseBody != null && !responseBody.isBlank()) {
            details.put("body", responseBody);
        }
        if (getCause() != null) {
            details.put("cause", getCause().getClass().getSimpleName());
        }
        return details;
    }
}
