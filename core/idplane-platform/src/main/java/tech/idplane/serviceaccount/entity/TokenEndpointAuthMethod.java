package tech.idplane.serviceaccount.entity;

import java.util.Arrays;
import java.util.List;

/**
 * How a client authenticates at the token endpoint.
 * {@link #NONE} marks a public client, which never carries a secret.
 */
public enum TokenEndpointAuthMethod {

    CLIENT_SECRET_BASIC("client_secret_basic"),
    CLIENT_SECRET_POST("client_secret_post"),
    PRIVATE_KEY_JWT("private_key_jwt"),
    NONE("none");

    private final String value;

    TokenEndpointAuthMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static boolean isValid(String value) {
        return Arrays.stream(values()).anyMatch(m -> m.value.equals(value));
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(TokenEndpointAuthMethod::value).toList();
    }
}
