package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.idplane.platform.idp.RemoteClient;

import java.util.List;

/**
 * Pending login request, fetched by its login challenge.
 *
 * @param skip true when the server already authenticated the subject and the
 *             login must be accepted without asking again
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginRequest(
    @JsonProperty("challenge") String challenge,
    @JsonProperty("skip") boolean skip,
    @JsonProperty("subject") String subject,
    @JsonProperty("client") RemoteClient client,
    @JsonProperty("request_url") String requestUrl,
    @JsonProperty("requested_scope") List<String> requestedScope,
    @JsonProperty("requested_access_token_audience") List<String> requestedAccessTokenAudience
) {}
