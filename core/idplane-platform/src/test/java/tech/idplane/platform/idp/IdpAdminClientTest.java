package tech.idplane.platform.idp;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tech.idplane.platform.idp.challenge.AcceptLogin;
import tech.idplane.platform.idp.challenge.CompletedRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests IdpAdminClient against a stubbed admin API.
 */
class IdpAdminClientTest {

    private WireMockServer wireMockServer;
    private IdpAdminClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(wireMockConfig().dynamicPort());
        wireMockServer.start();
        client = new IdpAdminClient(new TestIdpConfig("http://localhost:" + wireMockServer.port() + "/", 2));
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    // ========================================================================
    // Client registry
    // ========================================================================

    @Nested
    @DisplayName("Client registry")
    class ClientRegistryTests {

        @Test
        @DisplayName("createClient should post snake_case JSON without null fields")
        void createClient_shouldPostSnakeCaseJson() {
            // Arrange
            wireMockServer.stubFor(post(urlEqualTo("/admin/clients"))
                .willReturn(aResponse()
                    .withStatus(201)
                    .withHeader("Content-Type", "application/json")
                    .withBody("{\"client_id\":\"svc-1\",\"client_name\":\"Service One\",\"created_at\":\"2024-01-01T00:00:00Z\"}")));

            RemoteClient request = RemoteClient.builder()
                .clientId("svc-1")
                .clientName("Service One")
                .grantTypes(List.of("client_credentials"))
                .skipConsent(true)
                .build();

            // Act
            RemoteClient created = client.createClient(request);

            // Assert
            assertThat(created.clientId()).isEqualTo("svc-1");
            wireMockServer.verify(postRequestedFor(urlEqualTo("/admin/clients"))
                .withHeader("Content-Type", containing("application/json"))
                .withRequestBody(matchingJsonPath("$.client_id", equalTo("svc-1")))
                .withRequestBody(matchingJsonPath("$.grant_types[0]", equalTo("client_credentials")))
                .withRequestBody(matchingJsonPath("$.skip_consent", equalTo("true")))
                .withRequestBody(notMatching(".*client_secret.*")));
        }

        @Test
        @DisplayName("getClient should return empty on 404")
        void getClient_shouldReturnEmpty_whenNotFound() {
            wireMockServer.stubFor(get(urlEqualTo("/admin/clients/unknown"))
                .willReturn(aResponse().withStatus(404).withBody("{\"error\":\"Not Found\"}")));

            Optional<RemoteClient> result = client.getClient("unknown");

            assertThat(result).isEmpty();
        }

        @Test
        @DisplayName("getClient should parse the client and ignore unknown fields")
        void getClient_shouldParseClient() {
            wireMockServer.stubFor(get(urlEqualTo("/admin/clients/svc-1"))
                .willReturn(okJson("{\"client_id\":\"svc-1\",\"scope\":\"a b\",\"redirect_uris\":[\"https://a.example\"],\"subject_type\":\"public\"}")));

            Optional<RemoteClient> result = client.getClient("svc-1");

            assertThat(result).isPresent();
            assertThat(result.get().scope()).isEqualTo("a b");
            assertThat(result.get().redirectUris()).containsExactly("https://a.example");
        }

        @Test
        @DisplayName("updateClient should PUT to the client path")
        void updateClient_shouldPutClient() {
            wireMockServer.stubFor(put(urlEqualTo("/admin/clients/svc-1"))
                .willReturn(okJson("{\"client_id\":\"svc-1\",\"client_name\":\"Renamed\"}")));

            RemoteClient updated = client.updateClient("svc-1",
                RemoteClient.builder().clientId("svc-1").clientName("Renamed").build());

            assertThat(updated.clientName()).isEqualTo("Renamed");
            wireMockServer.verify(putRequestedFor(urlEqualTo("/admin/clients/svc-1"))
                .withRequestBody(matchingJsonPath("$.client_name", equalTo("Renamed"))));
        }

        @Test
        @DisplayName("deleteClient should treat 404 as already deleted")
        void deleteClient_shouldReturnTrue_whenNotFound() {
            wireMockServer.stubFor(delete(urlEqualTo("/admin/clients/gone"))
                .willReturn(aResponse().withStatus(404)));

            assertThat(client.deleteClient("gone")).isTrue();
        }

        @Test
        @DisplayName("deleteClient should succeed on 204")
        void deleteClient_shouldReturnTrue_whenDeleted() {
            wireMockServer.stubFor(delete(urlEqualTo("/admin/clients/svc-1"))
                .willReturn(aResponse().withStatus(204)));

            assertThat(client.deleteClient("svc-1")).isTrue();
            wireMockServer.verify(deleteRequestedFor(urlEqualTo("/admin/clients/svc-1")));
        }

        @Test
        @DisplayName("listAllClients should page until a short page")
        void listAllClients_shouldPageThroughRegistry() {
            // Arrange
            wireMockServer.stubFor(get(urlPathEqualTo("/admin/clients"))
                .withQueryParam("offset", equalTo("0"))
                .willReturn(okJson("[{\"client_id\":\"a\"},{\"client_id\":\"b\"}]")));
            wireMockServer.stubFor(get(urlPathEqualTo("/admin/clients"))
                .withQueryParam("offset", equalTo("2"))
                .willReturn(okJson("[{\"client_id\":\"c\"}]")));

            // Act
            List<RemoteClient> all = client.listAllClients();

            // Assert
            assertThat(all).extracting(RemoteClient::clientId).containsExactly("a", "b", "c");
            wireMockServer.verify(2, getRequestedFor(urlPathEqualTo("/admin/clients"))
                .withQueryParam("limit", equalTo("2")));
        }
    }

    // ========================================================================
    // Failures
    // ========================================================================

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("a server error should raise with status and body")
        void createClient_shouldThrow_whenServerErrors() {
            wireMockServer.stubFor(post(urlEqualTo("/admin/clients"))
                .willReturn(aResponse().withStatus(500).withBody("{\"error\":\"internal\"}")));

            assertThatThrownBy(() -> client.createClient(RemoteClient.builder().clientId("svc-1").build()))
                .isInstanceOf(IdpIntegrationException.class)
                .satisfies(e -> {
                    IdpIntegrationException ex = (IdpIntegrationException) e;
                    assertThat(ex.getStatusCode()).isEqualTo(500);
                    assertThat(ex.getResponseBody()).contains("internal");
                    assertThat(ex.isTransportFailure()).isFalse();
                });
        }

        @Test
        @DisplayName("a conflict on create should raise with status 409")
        void createClient_shouldThrow_whenConflict() {
            wireMockServer.stubFor(post(urlEqualTo("/admin/clients"))
                .willReturn(aResponse().withStatus(409).withBody("{\"error\":\"exists\"}")));

            assertThatThrownBy(() -> client.createClient(RemoteClient.builder().clientId("svc-1").build()))
                .isInstanceOf(IdpIntegrationException.class)
                .extracting(e -> ((IdpIntegrationException) e).getStatusCode())
                .isEqualTo(409);
        }

        @Test
        @DisplayName("a refused connection should raise with status 0")
        void getClient_shouldThrowTransportFailure_whenServerDown() {
            IdpAdminClient unreachable = new IdpAdminClient(new TestIdpConfig("http://localhost:1", 500));

            assertThatThrownBy(() -> unreachable.getClient("svc-1"))
                .isInstanceOf(IdpIntegrationException.class)
                .satisfies(e -> assertThat(((IdpIntegrationException) e).isTransportFailure()).isTrue());
        }

        @Test
        @DisplayName("a failed page should fail the whole listing")
        void listAllClients_shouldThrow_whenPageFails() {
            wireMockServer.stubFor(get(urlPathEqualTo("/admin/clients"))
                .willReturn(aResponse().withStatus(503)));

            assertThatThrownBy(() -> client.listAllClients())
                .isInstanceOf(IdpIntegrationException.class);
        }
    }

    // ========================================================================
    // Health and challenges
    // ========================================================================

    @Nested
    @DisplayName("Health and challenges")
    class HealthAndChallengeTests {

        @Test
        @DisplayName("healthCheck should be true on 200 and false otherwise")
        void healthCheck_shouldReflectReadiness() {
            wireMockServer.stubFor(get(urlEqualTo("/health/ready")).willReturn(okJson("{\"status\":\"ok\"}")));
            assertThat(client.healthCheck()).isTrue();

            wireMockServer.stubFor(get(urlEqualTo("/health/ready")).willReturn(aResponse().withStatus(503)));
            assertThat(client.healthCheck()).isFalse();
        }

        @Test
        @DisplayName("healthCheck should be false when the server is unreachable")
        void healthCheck_shouldBeFalse_whenUnreachable() {
            IdpAdminClient unreachable = new IdpAdminClient(new TestIdpConfig("http://localhost:1", 500));

            assertThat(unreachable.healthCheck()).isFalse();
        }

        @Test
        @DisplayName("acceptLoginRequest should return the redirect supplied by the server")
        void acceptLoginRequest_shouldReturnRedirect() {
            wireMockServer.stubFor(put(urlPathEqualTo("/admin/oauth2/auth/requests/login/accept"))
                .withQueryParam("login_challenge", equalTo("abc"))
                .willReturn(okJson("{\"redirect_to\":\"https://idp.example/next\"}")));

            CompletedRequest completed = client.acceptLoginRequest("abc", new AcceptLogin("user-1", true, 3600));

            assertThat(completed.redirectTo()).isEqualTo("https://idp.example/next");
            wireMockServer.verify(putRequestedFor(urlPathEqualTo("/admin/oauth2/auth/requests/login/accept"))
                .withRequestBody(matchingJsonPath("$.subject", equalTo("user-1"))));
        }

        @Test
        @DisplayName("acceptLoginRequest should send the session context and omit it when absent")
        void acceptLoginRequest_shouldSendContext() {
            wireMockServer.stubFor(put(urlPathEqualTo("/admin/oauth2/auth/requests/login/accept"))
                .willReturn(okJson("{\"redirect_to\":\"https://idp.example/next\"}")));

            client.acceptLoginRequest("ctx", new AcceptLogin("usr_1", true, 86400, Map.of("email", "ada@example.com")));
            client.acceptLoginRequest("plain", new AcceptLogin("usr_1", false, 3600));

            wireMockServer.verify(putRequestedFor(urlPathEqualTo("/admin/oauth2/auth/requests/login/accept"))
                .withQueryParam("login_challenge", equalTo("ctx"))
                .withRequestBody(matchingJsonPath("$.context.email", equalTo("ada@example.com")))
                .withRequestBody(matchingJsonPath("$.remember_for", equalTo("86400"))));
            wireMockServer.verify(putRequestedFor(urlPathEqualTo("/admin/oauth2/auth/requests/login/accept"))
                .withQueryParam("login_challenge", equalTo("plain"))
                .withRequestBody(notMatching(".*\"context\".*")));
        }
    }

    private record TestIdpConfig(String baseUrl, int pageSize) implements IdpConfig {

        @Override
        public int timeout() {
            return 5;
        }

        @Override
        public int healthTimeout() {
            return 2;
        }

        @Override
        public int maxClients() {
            return 10000;
        }
    }
}
