package tech.idplane.user.operations;

import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Field checks shared by user create and update.
 */
public final class UserValidator {

    static final int MAX_EMAIL_LENGTH = 255;
    static final int MAX_DISPLAY_NAME_LENGTH = 255;

    private UserValidator() {
    }

    public static Optional<UseCaseError> validateEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.of(new UseCaseError.ValidationError("EMAIL_REQUIRED", "Email is required", Map.of()));
        }
        int at = email.indexOf('@');
        if (email.length() > MAX_EMAIL_LENGTH || at <= 0 || at != email.lastIndexOf('@')
                || at == email.length() - 1 || email.chars().anyMatch(Character::isWhitespace)) {
            return Optional.of(new UseCaseError.ValidationError(
                "INVALID_EMAIL",
                "Invalid email address",
                Map.of("email", email)
            ));
        }
        return Optional.empty();
    }

    public static Optional<UseCaseError> validateDisplayName(String displayName) {
        if (displayName != null && displayName.length() > MAX_DISPLAY_NAME_LENGTH) {
            return Optional.of(new UseCaseError.ValidationError(
                "DISPLAY_NAME_TOO_LONG",
                "Display name must be at most " + MAX_DISPLAY_NAME_LENGTH + " characters",
                Map.of("length", displayName.length())
            ));
        }
        return Optional.empty();
    }

    /**
     * Emails are stored trimmed and lower-cased so lookups ignore case.
     */
    public static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
