package tech.idplane.platform.idp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * OAuth2 client object as exchanged with the authorization server admin API.
 *
 * <p>Every field is optional. Null fields are left out of request bodies, and
 * fields the server returns that are not listed here are ignored.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteClient(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret,
    @JsonProperty("client_name") String clientName,
    @JsonProperty("grant_types") List<String> grantTypes,
    @JsonProperty("response_types") List<String> responseTypes,
    @JsonProperty("scope") String scope,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
    @JsonProperty("token_endpoint_auth_signing_alg") String tokenEndpointAuthSigningAlg,
    @JsonProperty("audience") List<String> audience,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("post_logout_redirect_uris") List<String> postLogoutRedirectUris,
    @JsonProperty("allowed_cors_origins") List<String> allowedCorsOrigins,
    @JsonProperty("skip_consent") Boolean skipConsent,
    @JsonProperty("owner") String owner,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("jwks") Map<String, Object> jwks,
    @JsonProperty("jwks_uri") String jwksUri,
    @JsonProperty("id_token_signed_response_alg") String idTokenSignedResponseAlg
) {}
