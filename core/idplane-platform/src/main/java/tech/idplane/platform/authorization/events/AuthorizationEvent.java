package tech.idplane.platform.authorization.events;

import tech.idplane.platform.common.DomainEvent;

/**
 * Sealed hierarchy for role events.
 */
public sealed interface AuthorizationEvent extends DomainEvent
    permits RoleCreated, RoleUpdated, RoleDeleted {}
