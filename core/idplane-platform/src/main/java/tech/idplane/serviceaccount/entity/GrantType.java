package tech.idplane.serviceaccount.entity;

import java.util.Arrays;
import java.util.List;

/**
 * OAuth2 grant types a service account may be registered with.
 */
public enum GrantType {

    CLIENT_CREDENTIALS("client_credentials"),
    AUTHORIZATION_CODE("authorization_code"),
    REFRESH_TOKEN("refresh_token"),
    IMPLICIT("implicit"),
    PASSWORD("password");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static boolean isValid(String value) {
        return Arrays.stream(values()).anyMatch(g -> g.value.equals(value));
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(GrantType::value).toList();
    }
}
