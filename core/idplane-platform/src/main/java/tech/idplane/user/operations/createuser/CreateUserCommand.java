package tech.idplane.user.operations.createuser;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Command to create a user with a password.
 *
 * @param active  null means active
 * @param roleIds roles to grant; every id must exist
 */
public record CreateUserCommand(
    String email,
    @JsonIgnore String password,
    String displayName,
    Boolean active,
    List<String> roleIds
) {}
