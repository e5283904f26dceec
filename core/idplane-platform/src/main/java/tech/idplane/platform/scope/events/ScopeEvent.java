package tech.idplane.platform.scope.events;

import tech.idplane.platform.common.DomainEvent;

/**
 * Sealed hierarchy for scope events.
 */
public sealed interface ScopeEvent extends DomainEvent
    permits ScopeCreated, ScopeUpdated, ScopeDeleted, ScopesActivationChanged, ScopesDeleted {}
