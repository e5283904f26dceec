package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pending logout request, fetched by its logout challenge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogoutRequest(
    @JsonProperty("challenge") String challenge,
    @JsonProperty("subject") String subject,
    @JsonProperty("sid") String sessionId,
    @JsonProperty("request_url") String requestUrl,
    @JsonProperty("rp_initiated") boolean rpInitiated
) {}
