package tech.idplane.serviceaccount.mapper;

import tech.idplane.platform.idp.RemoteClient;
import tech.idplane.serviceaccount.entity.ServiceAccount;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the authorization server's client object from a service account.
 *
 * <p>The mapping is one-way: nothing read from the server is ever written back to
 * the local record. Local-only fields ({@code active}, description, created_by,
 * last_used_at, timestamps) have no counterpart in the output.
 */
public final class RemoteClientMapper {

    public static final String ACCOUNT_TYPE_METADATA_KEY = "account_type";

    private RemoteClientMapper() {
    }

    public static RemoteClient toRemoteClient(ServiceAccount sa) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (sa.clientMetadata != null) {
            metadata.putAll(sa.clientMetadata);
        }
        if (sa.accountType != null) {
            metadata.put(ACCOUNT_TYPE_METADATA_KEY, sa.accountType.value());
        }

        return RemoteClient.builder()
            .clientId(sa.clientId)
            .clientSecret(sa.isPublicClient() ? null : sa.clientSecret)
            .clientName(sa.clientName)
            .grantTypes(copy(sa.grantTypes))
            .responseTypes(copy(sa.responseTypes))
            .scope(sa.scopeString())
            .tokenEndpointAuthMethod(sa.tokenEndpointAuthMethod)
            .tokenEndpointAuthSigningAlg(sa.tokenEndpointAuthSigningAlg)
            .audience(copy(sa.audience))
            .redirectUris(copy(sa.redirectUris))
            .postLogoutRedirectUris(copy(sa.postLogoutRedirectUris))
            .allowedCorsOrigins(copy(sa.allowedCorsOrigins))
            .skipConsent(sa.skipConsent)
            .owner(sa.owner)
            .metadata(metadata)
            .jwks(sa.jwks)
            .jwksUri(sa.jwksUri)
            .idTokenSignedResponseAlg(sa.idTokenSignedResponseAlg != null
                ? sa.idTokenSignedResponseAlg : ServiceAccount.DEFAULT_ID_TOKEN_ALG)
            .build();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? List.copyOf(values) : List.of();
    }
}
