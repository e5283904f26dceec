package tech.idplane.serviceaccount.operations.updateserviceaccount;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.List;
import java.util.Map;

/**
 * Command to update a service account. Every field except the id is optional:
 * null means "leave unchanged". {@code roleIds} and {@code scopeIds}, when present,
 * replace the whole association set.
 *
 * @param syncToIdp push the resulting client to the authorization server after the local commit
 */
@Builder(toBuilder = true)
public record UpdateServiceAccountCommand(
    String serviceAccountId,
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
    Boolean active,
    List<String> roleIds,
    List<String> scopeIds,
    boolean syncToIdp
) {

    public static UpdateServiceAccountCommand activation(String serviceAccountId, boolean active) {
        return UpdateServiceAccountCommand.builder()
            .serviceAccountId(serviceAccountId)
            .active(active)
            .syncToIdp(true)
            .build();
    }
}
