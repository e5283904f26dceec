package tech.idplane.platform.sync;

import tech.idplane.platform.idp.RemoteClient;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Field-level comparison between the client derived from a service account and the
 * client the authorization server actually holds.
 *
 * <p>List fields compare as sets, so ordering and duplicates never count as drift.
 * A missing list equals an empty one. The scope string compares as its set of
 * space-separated tokens. Other scalars compare by equality, with a missing
 * {@code skip_consent} read as false.
 */
public final class ClientDrift {

    private static final List<ListField> LIST_FIELDS = List.of(
        new ListField("grant_types", RemoteClient::grantTypes),
        new ListField("response_types", RemoteClient::responseTypes),
        new ListField("redirect_uris", RemoteClient::redirectUris),
        new ListField("audience", RemoteClient::audience),
        new ListField("allowed_cors_origins", RemoteClient::allowedCorsOrigins),
        new ListField("post_logout_redirect_uris", RemoteClient::postLogoutRedirectUris)
    );

    private ClientDrift() {
    }

    /**
     * @return names of the compared fields that differ, in a stable order; empty when in sync
     */
    public static List<String> differingFields(RemoteClient desired, RemoteClient actual) {
        List<String> differing = new ArrayList<>();
        if (!Objects.equals(desired.clientName(), actual.clientName())) {
            differing.add("client_name");
        }
        for (ListField field : LIST_FIELDS) {
            if (!asSet(field.getter().apply(desired)).equals(asSet(field.getter().apply(actual)))) {
                differing.add(field.name());
            }
        }
        if (!scopeTokens(desired.scope()).equals(scopeTokens(actual.scope()))) {
            differing.add("scope");
        }
        if (!Objects.equals(desired.tokenEndpointAuthMethod(), actual.tokenEndpointAuthMethod())) {
            differing.add("token_endpoint_auth_method");
        }
        if (Boolean.TRUE.equals(desired.skipConsent()) != Boolean.TRUE.equals(actual.skipConsent())) {
            differing.add("skip_consent");
        }
        return differing;
    }

    public static boolean hasDrift(RemoteClient desired, RemoteClient actual) {
        return !differingFields(desired, actual).isEmpty();
    }

    private static Set<String> asSet(List<String> values) {
        return values == null ? Set.of() : Set.copyOf(values);
    }

    private static Set<String> scopeTokens(String scope) {
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(scope.trim().split("\\s+")).collect(Collectors.toSet());
    }

    private record ListField(String name, Function<RemoteClient, List<String>> getter) {}
}
