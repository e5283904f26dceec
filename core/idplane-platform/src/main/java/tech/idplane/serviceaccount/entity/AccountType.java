package tech.idplane.serviceaccount.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of OAuth2 client. Scopes declare which categories may hold them.
 */
public enum AccountType {

    SERVICE_TO_SERVICE("service-to-service"),
    BROWSER("browser");

    private final String value;

    AccountType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parse a stored or submitted value. Matching ignores case, so "Service-to-service" is accepted.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static AccountType fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (AccountType type : values()) {
                if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown account type: " + value);
    }
}
