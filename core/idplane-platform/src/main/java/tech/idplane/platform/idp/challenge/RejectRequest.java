package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a login or consent reject call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RejectRequest(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription
) {

    public static RejectRequest accessDenied(String description) {
        return new RejectRequest("access_denied", description);
    }
}
