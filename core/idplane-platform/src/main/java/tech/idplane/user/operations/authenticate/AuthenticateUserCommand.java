package tech.idplane.user.operations.authenticate;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record AuthenticateUserCommand(
    String email,
    @JsonIgnore String password
) {}
