package tech.idplane.user.operations.removeuserrole;

public record RemoveUserRoleCommand(String userId, String roleId) {}
