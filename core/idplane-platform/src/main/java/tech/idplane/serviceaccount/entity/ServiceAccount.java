package tech.idplane.serviceaccount.entity;

import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.scope.Scope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service account: the local record of an OAuth2 client.
 *
 * <p>The client object registered in the authorization server is derived entirely
 * from this record and its scopes. {@code active}, {@code description},
 * {@code createdBy}, {@code lastUsedAt} and the timestamps are local-only and are
 * never sent to the server.
 */
public class ServiceAccount {

    public static final String DEFAULT_ID_TOKEN_ALG = "RS256";

    public String id;

    /**
     * Unique, immutable OAuth2 client id. The only key shared with the authorization server.
     */
    public String clientId;

    public String clientSecret;

    public String clientName;

    public String description;

    public AccountType accountType = AccountType.SERVICE_TO_SERVICE;

    public List<String> grantTypes = new ArrayList<>(List.of(GrantType.CLIENT_CREDENTIALS.value()));

    public List<String> responseTypes = new ArrayList<>(List.of("token"));

    public String tokenEndpointAuthMethod = TokenEndpointAuthMethod.CLIENT_SECRET_BASIC.value();

    public String tokenEndpointAuthSigningAlg;

    public List<String> audience = new ArrayList<>();

    public List<String> redirectUris = new ArrayList<>();

    public List<String> postLogoutRedirectUris = new ArrayList<>();

    public List<String> allowedCorsOrigins = new ArrayList<>();

    public boolean skipConsent = true;

    public String owner;

    /**
     * Free-form metadata forwarded to the authorization server.
     */
    public Map<String, Object> clientMetadata = new LinkedHashMap<>();

    public Map<String, Object> jwks;

    public String jwksUri;

    public String idTokenSignedResponseAlg = DEFAULT_ID_TOKEN_ALG;

    public boolean active = true;

    public String createdBy;

    public Instant lastUsedAt;

    public Instant createdAt;

    public Instant updatedAt;

    public List<Role> roles = new ArrayList<>();

    public List<Scope> scopes = new ArrayList<>();

    public ServiceAccount() {
    }

    public List<String> roleIds() {
        return roles.stream().map(r -> r.id).toList();
    }

    public List<String> scopeIds() {
        return scopes.stream().map(s -> s.id).toList();
    }

    public List<String> scopeNames() {
        return scopes.stream().map(s -> s.name).toList();
    }

    /**
     * Scope names joined by single spaces, as OAuth2 expects them.
     */
    public String scopeString() {
        return scopes.stream().map(s -> s.name).collect(Collectors.joining(" "));
    }

    public boolean isPublicClient() {
        return TokenEndpointAuthMethod.NONE.value().equals(tokenEndpointAuthMethod);
    }
}
