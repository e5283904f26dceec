package tech.idplane.serviceaccount.jpaentity;

import jakarta.persistence.*;
import tech.idplane.platform.common.panache.JsonMapConverter;
import tech.idplane.platform.common.panache.StringListConverter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JPA Entity for service_accounts table.
 * List-valued client fields are stored as JSON arrays.
 */
@Entity
@Table(name = "service_accounts")
public class ServiceAccountJpaEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "client_id", nullable = false, unique = true, length = 255, updatable = false)
    public String clientId;

    @Column(name = "client_secret", length = 255)
    public String clientSecret;

    @Column(name = "client_name", nullable = false, length = 255)
    public String clientName;

    @Column(name = "description", length = 1000)
    public String description;

    @Column(name = "account_type", nullable = false, length = 50)
    public String accountType;

    @Convert(converter = StringListConverter.class)
    @Column(name = "grant_types", length = 1000)
    public List<String> grantTypes = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "response_types", length = 1000)
    public List<String> responseTypes = new ArrayList<>();

    @Column(name = "token_endpoint_auth_method", nullable = false, length = 50)
    public String tokenEndpointAuthMethod;

    @Column(name = "token_endpoint_auth_signing_alg", length = 20)
    public String tokenEndpointAuthSigningAlg;

    @Convert(converter = StringListConverter.class)
    @Column(name = "audience", length = 4000)
    public List<String> audience = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "redirect_uris", length = 4000)
    public List<String> redirectUris = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "post_logout_redirect_uris", length = 4000)
    public List<String> postLogoutRedirectUris = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "allowed_cors_origins", length = 4000)
    public List<String> allowedCorsOrigins = new ArrayList<>();

    @Column(name = "skip_consent", nullable = false)
    public boolean skipConsent = true;

    @Column(name = "owner", length = 255)
    public String owner;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "client_metadata", length = 10000)
    public Map<String, Object> clientMetadata;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "jwks", length = 10000)
    public Map<String, Object> jwks;

    @Column(name = "jwks_uri", length = 1000)
    public String jwksUri;

    @Column(name = "id_token_signed_response_alg", length = 20)
    public String idTokenSignedResponseAlg;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "created_by", length = 255)
    public String createdBy;

    @Column(name = "last_used_at")
    public Instant lastUsedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public ServiceAccountJpaEntity() {
    }
}
