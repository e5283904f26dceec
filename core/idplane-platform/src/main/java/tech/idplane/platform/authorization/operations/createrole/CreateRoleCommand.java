package tech.idplane.platform.authorization.operations.createrole;

/**
 * Command to create a new Role.
 *
 * @param name        unique role name (e.g. "billing:reader")
 * @param description optional description of what the role grants
 */
public record CreateRoleCommand(
    String name,
    String description
) {}
