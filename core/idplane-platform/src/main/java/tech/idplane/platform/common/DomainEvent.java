package tech.idplane.platform.common;

import java.time.Instant;

/**
 * Base interface for all domain events.
 *
 * <p>Domain events represent facts about what happened (past tense) and are the
 * value a successful mutation returns. Every committed event produces one audit
 * log entry.
 *
 * <p>Naming convention: events are named in past tense, e.g.
 * {@code ServiceAccountCreated}, {@code RoleAssigned}, {@code ClientsSynced}.
 * Implement them as records.
 */
public interface DomainEvent {

    /**
     * Unique identifier for this event.
     */
    String eventId();

    /**
     * Event type code following the format {@code {domain}:{aggregate}:{action}}.
     * <p>Example: "iam:service-account:created". Stored as the audit action.
     */
    String eventType();

    /**
     * When the event occurred.
     */
    Instant time();

    String executionId();

    String correlationId();

    /**
     * Principal who initiated the action that produced this event.
     */
    String principalId();

    /**
     * Resource type recorded on the audit entry (e.g. "service_account").
     */
    String resourceType();

    /**
     * Identifier of the affected resource.
     */
    String resourceId();
}
