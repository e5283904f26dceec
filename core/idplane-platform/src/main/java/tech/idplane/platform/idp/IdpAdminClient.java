package tech.idplane.platform.idp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.idp.challenge.AcceptConsent;
import tech.idplane.platform.idp.challenge.AcceptLogin;
import tech.idplane.platform.idp.challenge.CompletedRequest;
import tech.idplane.platform.idp.challenge.ConsentRequest;
import tech.idplane.platform.idp.challenge.LoginRequest;
import tech.idplane.platform.idp.challenge.LogoutRequest;
import tech.idplane.platform.idp.challenge.RejectRequest;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Typed client for the authorization server admin API.
 *
 * <p>Covers the OAuth2 client registry and the login/consent/logout challenge
 * resolution used by the browser hand-off. A single instance is shared by the
 * application; it holds no state besides its configuration.
 *
 * <p>Every non-2xx answer, apart from 404 on get and delete, raises
 * {@link IdpIntegrationException}. Transport failures raise the same exception
 * with status 0. Nothing is retried here.
 */
@ApplicationScoped
public class IdpAdminClient {

    private static final Logger LOG = Logger.getLogger(IdpAdminClient.class);

    static final String CLIENTS_PATH = "/admin/clients";
    static final String REQUESTS_PATH = "/admin/oauth2/auth/requests";
    static final String HEALTH_PATH = "/health/ready";

    private final IdpConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Inject
    public IdpAdminClient(IdpConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.timeout()))
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    // ==================== OAuth2 clients ====================

    public RemoteClient createClient(RemoteClient client) {
        HttpResponse<String> response = send(jsonRequest("POST", CLIENTS_PATH, client), "create client " + client.clientId());
        requireSuccess(response, "create client " + client.clientId());
        LOG.debugf("Created client %s in authorization server", client.clientId());
        return read(response, new TypeReference<RemoteClient>() {});
    }

    /**
     * Fetch a client, or empty when the server does not know it.
     */
    public Optional<RemoteClient> getClient(String clientId) {
        HttpResponse<String> response = send(request(clientPath(clientId)).GET().build(), "get client " + clientId);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "get client " + clientId);
        return Optional.of(read(response, new TypeReference<RemoteClient>() {}));
    }

    public RemoteClient updateClient(String clientId, RemoteClient client) {
        HttpResponse<String> response = send(jsonRequest("PUT", clientPath(clientId), client), "update client " + clientId);
        requireSuccess(response, "update client " + clientId);
        LOG.debugf("Updated client %s in authorization server", clientId);
        return read(response, new TypeReference<RemoteClient>() {});
    }

    /**
     * Delete a client. A client the server does not know counts as deleted.
     *
     * @return true once the client no longer exists remotely
     */
    public boolean deleteClient(String clientId) {
        HttpResponse<String> response = send(request(clientPath(clientId)).DELETE().build(), "delete client " + clientId);
        if (response.statusCode() == 404) {
            LOG.debugf("Client %s was already absent from authorization server", clientId);
            return true;
        }
        requireSuccess(response, "delete client " + clientId);
        LOG.debugf("Deleted client %s from authorization server", clientId);
        return true;
    }

    public List<RemoteClient> listClients(int limit, int offset) {
        String path = CLIENTS_PATH + "?limit=" + limit + "&offset=" + offset;
        HttpResponse<String> response = send(request(path).GET().build(), "list clients");
        requireSuccess(response, "list clients");
        List<RemoteClient> clients = read(response, new TypeReference<List<RemoteClient>>() {});
        return clients != null ? clients : List.of();
    }

    /**
     * Page through the whole registry until a short page or the configured cap.
     */
    public List<RemoteClient> listAllClients() {
        int pageSize = config.pageSize();
        List<RemoteClient> all = new ArrayList<>();
        int offset = 0;
        while (all.size() < config.maxClients()) {
            List<RemoteClient> page = listClients(pageSize, offset);
            all.addAll(page);
            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }
        if (all.size() >= config.maxClients()) {
            LOG.warnf("Client listing stopped at the cap of %d clients", config.maxClients());
            return List.copyOf(all.subList(0, config.maxClients()));
        }
        return all;
    }

    /**
     * Readiness probe. Never throws.
     */
    public boolean healthCheck() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + HEALTH_PATH))
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(config.healthTimeout()))
            .GET()
            .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            LOG.warnf("Authorization server health check failed: %s", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Authorization server health check interrupted");
            return false;
        }
    }

    // ==================== Login / consent / logout challenges ====================

    public LoginRequest getLoginRequest(String challenge) {
        return getChallenge("login", "login_challenge", challenge, new TypeReference<LoginRequest>() {});
    }

    public CompletedRequest acceptLoginRequest(String challenge, AcceptLogin body) {
        return completeChallenge("login", "accept", "login_challenge", challenge, body);
    }

    public CompletedRequest rejectLoginRequest(String challenge, RejectRequest body) {
        return completeChallenge("login", "reject", "login_challenge", challenge, body);
    }

    public ConsentRequest getConsentRequest(String challenge) {
        return getChallenge("consent", "consent_challenge", challenge, new TypeReference<ConsentRequest>() {});
    }

    public CompletedRequest acceptConsentRequest(String challenge, AcceptConsent body) {
        return completeChallenge("consent", "accept", "consent_challenge", challenge, body);
    }

    public CompletedRequest rejectConsentRequest(String challenge, RejectRequest body) {
        return completeChallenge("consent", "reject", "consent_challenge", challenge, body);
    }

    public LogoutRequest getLogoutRequest(String challenge) {
        return getChallenge("logout", "logout_challenge", challenge, new TypeReference<LogoutRequest>() {});
    }

    public CompletedRequest acceptLogoutRequest(String challenge) {
        return completeChallenge("logout", "accept", "logout_challenge", challenge, null);
    }

    public void rejectLogoutRequest(String challenge) {
        completeChallenge("logout", "reject", "logout_challenge", challenge, null);
    }

    private <T> T getChallenge(String flow, String param, String challenge, TypeReference<T> type) {
        String path = REQUESTS_PATH + "/" + flow + "?" + param + "=" + encode(challenge);
        HttpResponse<String> response = send(request(path).GET().build(), "get " + flow + " request");
        requireSuccess(response, "get " + flow + " request");
        return read(response, type);
    }

    private CompletedRequest completeChallenge(String flow, String action, String param, String challenge, Object body) {
        String path = REQUESTS_PATH + "/" + flow + "/" + action + "?" + param + "=" + encode(challenge);
        String operation = action + " " + flow + " request";
        HttpResponse<String> response = send(jsonRequest("PUT", path, body), operation);
        requireSuccess(response, operation);
        if (response.body() == null || response.body().isBlank()) {
            return new CompletedRequest(null);
        }
        return read(response, new TypeReference<CompletedRequest>() {});
    }

    // ==================== Plumbing ====================

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(baseUrl() + path))
            .header("Accept", "application/json")
            .timeout(Duration.ofSeconds(config.timeout()));
    }

    private HttpRequest jsonRequest(String method, String path, Object body) {
        String json;
        try {
            json = body != null ? objectMapper.writeValueAsString(body) : "{}";
        } catch (JsonProcessingException e) {
            throw new IdpIntegrationException("Failed to serialize request body for " + method + " " + path, e);
        }
        return request(path)
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(json))
            .build();
    }

    private HttpResponse<String> send(HttpRequest request, String operation) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new IdpIntegrationException("Timed out trying to " + operation, e);
        } catch (IOException e) {
            throw new IdpIntegrationException("Failed to " + operation + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IdpIntegrationException("Interrupted while trying to " + operation, e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String operation) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IdpIntegrationException(
                "Failed to " + operation + ": HTTP " + status,
                status,
                response.body()
            );
        }
    }

    private <T> T read(HttpResponse<String> response, TypeReference<T> type) {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IdpIntegrationException("Failed to parse response", response.statusCode(), body, e);
        }
    }

    private String baseUrl() {
        return config.baseUrl().replaceAll("/$", "");
    }

    private static String clientPath(String clientId) {
        return CLIENTS_PATH + "/" + encode(clientId);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
