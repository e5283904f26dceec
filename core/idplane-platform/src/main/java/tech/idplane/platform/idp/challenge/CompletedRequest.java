package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to an accept or reject call: where the browser goes next.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompletedRequest(
    @JsonProperty("redirect_to") String redirectTo
) {}
