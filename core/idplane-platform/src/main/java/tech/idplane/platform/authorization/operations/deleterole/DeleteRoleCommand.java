package tech.idplane.platform.authorization.operations.deleterole;

public record DeleteRoleCommand(String roleId) {}
