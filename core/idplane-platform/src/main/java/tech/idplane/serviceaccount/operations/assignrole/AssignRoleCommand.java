package tech.idplane.serviceaccount.operations.assignrole;

/**
 * Command to grant a role on a service account. Roles are local only and never pushed remotely.
 */
public record AssignRoleCommand(
    String serviceAccountId,
    String roleId
) {}
