package tech.idplane.user.operations.resetpassword;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Command to replace a user's password without knowing the old one.
 */
public record ResetPasswordCommand(
    String userId,
    @JsonIgnore String newPassword
) {}
