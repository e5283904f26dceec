package tech.idplane.platform.scope.operations.setscopesactive;

import java.util.List;

public record SetScopesActiveCommand(List<String> scopeIds, boolean active) {}
