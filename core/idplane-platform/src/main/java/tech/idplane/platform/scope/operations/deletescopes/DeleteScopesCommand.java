package tech.idplane.platform.scope.operations.deletescopes;

import java.util.List;

public record DeleteScopesCommand(List<String> scopeIds) {}
