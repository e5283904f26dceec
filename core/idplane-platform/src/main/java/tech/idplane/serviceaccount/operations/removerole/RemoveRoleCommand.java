package tech.idplane.serviceaccount.operations.removerole;

/**
 * Command to revoke a role on a service account. Roles are local only and never pushed remotely.
 */
public record RemoveRoleCommand(
    String serviceAccountId,
    String roleId
) {}
