package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of a consent accept call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AcceptConsent(
    @JsonProperty("grant_scope") List<String> grantScope,
    @JsonProperty("grant_access_token_audience") List<String> grantAccessTokenAudience,
    @JsonProperty("remember") Boolean remember,
    @JsonProperty("remember_for") Integer rememberFor
) {}
