package tech.idplane.serviceaccount.operations.createserviceaccount;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.List;
import java.util.Map;

/**
 * Command to create a service account and register it as an OAuth2 client.
 *
 * <p>Null optional fields take the defaults of {@code ServiceAccount}. The client
 * secret is excluded from the audit record.
 */
@Builder
public record CreateServiceAccountCommand(
    String clientId,
    @JsonIgnore String clientSecret,
    String clientName,
    String description,
    AccountType accountType,
    List<String> grantTypes,
    List<String> responseTypes,
    String tokenEndpointAuthMethod,
    String tokenEndpointAuthSigningAlg,
    List<String> audience,
    List<String> redirectUris,
    List<String> postLogoutRedirectUris,
    List<String> allowedCorsOrigins,
    Boolean skipConsent,
    String owner,
    Map<String, Object> clientMetadata,
    Map<String, Object> jwks,
    String jwksUri,
    String idTokenSignedResponseAlg,
    List<String> roleIds,
    List<String> scopeIds,
    String createdBy,
    boolean syncToIdp
) {}
