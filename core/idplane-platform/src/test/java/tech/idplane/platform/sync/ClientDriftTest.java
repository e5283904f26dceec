package tech.idplane.platform.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.idplane.platform.idp.RemoteClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ClientDrift field comparison.
 */
class ClientDriftTest {

    private static RemoteClient base() {
        return RemoteClient.builder()
            .clientId("svc-1")
            .clientName("Service One")
            .grantTypes(List.of("client_credentials", "refresh_token"))
            .responseTypes(List.of("token"))
            .scope("orders.read orders.write")
            .tokenEndpointAuthMethod("client_secret_basic")
            .redirectUris(List.of("https://a.example"))
            .audience(List.of())
            .allowedCorsOrigins(List.of())
            .postLogoutRedirectUris(List.of())
            .skipConsent(true)
            .build();
    }

    @Test
    @DisplayName("identical clients should show no drift")
    void differingFields_shouldBeEmpty_whenClientsMatch() {
        assertThat(ClientDrift.differingFields(base(), base())).isEmpty();
        assertThat(ClientDrift.hasDrift(base(), base())).isFalse();
    }

    @Test
    @DisplayName("list order should not count as drift")
    void differingFields_shouldIgnoreListOrder() {
        RemoteClient actual = base().toBuilder()
            .grantTypes(List.of("refresh_token", "client_credentials"))
            .build();

        assertThat(ClientDrift.differingFields(base(), actual)).isEmpty();
    }

    @Test
    @DisplayName("an added redirect URI should be reported as redirect_uris drift")
    void differingFields_shouldReportRedirectUris_whenSetDiffers() {
        RemoteClient desired = base().toBuilder()
            .redirectUris(List.of("https://a.example", "https://b.example"))
            .build();

        assertThat(ClientDrift.differingFields(desired, base())).containsExactly("redirect_uris");
    }

    @Test
    @DisplayName("a missing list on the remote side should equal an empty local list")
    void differingFields_shouldTreatNullListAsEmpty() {
        RemoteClient actual = base().toBuilder()
            .audience(null)
            .allowedCorsOrigins(null)
            .postLogoutRedirectUris(null)
            .build();

        assertThat(ClientDrift.differingFields(base(), actual)).isEmpty();
    }

    @Test
    @DisplayName("scope tokens in another order should not count as drift, a new token should")
    void differingFields_shouldCompareScopeTokens() {
        RemoteClient reordered = base().toBuilder().scope("orders.write  orders.read").build();
        RemoteClient reduced = base().toBuilder().scope("orders.read").build();

        assertThat(ClientDrift.differingFields(base(), reordered)).isEmpty();
        assertThat(ClientDrift.differingFields(base(), reduced)).containsExactly("scope");
    }

    @Test
    @DisplayName("scalar changes should be reported by field name")
    void differingFields_shouldReportScalars() {
        RemoteClient actual = base().toBuilder()
            .clientName("Renamed")
            .tokenEndpointAuthMethod("client_secret_post")
            .skipConsent(false)
            .build();

        assertThat(ClientDrift.differingFields(base(), actual))
            .containsExactly("client_name", "token_endpoint_auth_method", "skip_consent");
    }

    @Test
    @DisplayName("fields outside the compared set should be ignored")
    void differingFields_shouldIgnoreUncomparedFields() {
        RemoteClient actual = base().toBuilder()
            .clientSecret("different")
            .owner("someone-else")
            .metadata(Map.of("account_type", "browser"))
            .idTokenSignedResponseAlg("ES256")
            .build();

        assertThat(ClientDrift.differingFields(base(), actual)).isEmpty();
    }
}
