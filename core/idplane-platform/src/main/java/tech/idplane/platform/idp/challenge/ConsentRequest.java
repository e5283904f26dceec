package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.idplane.platform.idp.RemoteClient;

import java.util.List;

/**
 * Pending consent request, fetched by its consent challenge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConsentRequest(
    @JsonProperty("challenge") String challenge,
    @JsonProperty("skip") boolean skip,
    @JsonProperty("subject") String subject,
    @JsonProperty("client") RemoteClient client,
    @JsonProperty("requested_scope") List<String> requestedScope,
    @JsonProperty("requested_access_token_audience") List<String> requestedAccessTokenAudience
) {}
