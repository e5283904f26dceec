package tech.idplane.serviceaccount.operations;

import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.serviceaccount.entity.GrantType;
import tech.idplane.serviceaccount.entity.TokenEndpointAuthMethod;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Field checks shared by create and update. Null values mean "not supplied" and pass.
 */
public final class ServiceAccountValidator {

    public static final int MAX_IDENTIFIER_LENGTH = 255;

    private ServiceAccountValidator() {
    }

    public static Optional<UseCaseError> requireIdentifier(String field, String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(new UseCaseError.ValidationError(
                errorPrefix(field) + "_REQUIRED",
                field + " is required",
                Map.of("field", field)
            ));
        }
        return checkLength(field, value);
    }

    public static Optional<UseCaseError> checkName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isBlank()) {
            return Optional.of(new UseCaseError.ValidationError(
                "CLIENT_NAME_BLANK",
                "clientName must not be blank",
                Map.of("field", "clientName")
            ));
        }
        return checkLength("clientName", value);
    }

    public static Optional<UseCaseError> checkGrantTypes(List<String> grantTypes) {
        if (grantTypes == null) {
            return Optional.empty();
        }
        if (grantTypes.isEmpty()) {
            return Optional.of(new UseCaseError.ValidationError(
                "GRANT_TYPES_REQUIRED",
                "At least one grant type is required",
                Map.of("allowed", GrantType.allowedValues())
            ));
        }
        for (String grantType : grantTypes) {
            if (!GrantType.isValid(grantType)) {
                return Optional.of(new UseCaseError.ValidationError(
                    "INVALID_GRANT_TYPE",
                    "Invalid grant type: " + grantType,
                    Map.of("grantType", String.valueOf(grantType), "allowed", GrantType.allowedValues())
                ));
            }
        }
        return Optional.empty();
    }

    public static Optional<UseCaseError> checkAuthMethod(String authMethod) {
        if (authMethod == null || TokenEndpointAuthMethod.isValid(authMethod)) {
            return Optional.empty();
        }
        return Optional.of(new UseCaseError.ValidationError(
            "INVALID_TOKEN_ENDPOINT_AUTH_METHOD",
            "Invalid token endpoint auth method: " + authMethod,
            Map.of("tokenEndpointAuthMethod", authMethod, "allowed", TokenEndpointAuthMethod.allowedValues())
        ));
    }

    /**
     * Return the first error among the supplied checks.
     */
    @SafeVarargs
    public static Optional<UseCaseError> firstError(Optional<UseCaseError>... checks) {
        for (Optional<UseCaseError> check : checks) {
            if (check.isPresent()) {
                return check;
            }
        }
        return Optional.empty();
    }

    /**
     * {@code clientId} becomes {@code CLIENT_ID}.
     */
    static String errorPrefix(String field) {
        return field.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
    }

    private static Optional<UseCaseError> checkLength(String field, String value) {
        if (value.length() > MAX_IDENTIFIER_LENGTH) {
            return Optional.of(new UseCaseError.ValidationError(
                errorPrefix(field) + "_TOO_LONG",
                field + " must be at most " + MAX_IDENTIFIER_LENGTH + " characters",
                Map.of("field", field, "length", value.length())
            ));
        }
        return Optional.empty();
    }
}
