package tech.idplane.user.operations.assignuserrole;

public record AssignUserRoleCommand(String userId, String roleId) {}
