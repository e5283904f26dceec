package tech.idplane.platform.authorization.operations.updaterole;

/**
 * Command to rename a role or change its description. Null fields are left alone.
 */
public record UpdateRoleCommand(
    String roleId,
    String name,
    String description
) {}
