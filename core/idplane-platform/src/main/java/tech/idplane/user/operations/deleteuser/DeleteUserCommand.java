package tech.idplane.user.operations.deleteuser;

public record DeleteUserCommand(String userId) {}
