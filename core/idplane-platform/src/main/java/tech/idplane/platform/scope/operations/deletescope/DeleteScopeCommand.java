package tech.idplane.platform.scope.operations.deletescope;

public record DeleteScopeCommand(String scopeId) {}
