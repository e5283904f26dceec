package tech.idplane.platform.common;

import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Context for a use case execution.
 *
 * <p>Carries tracing IDs and the acting principal through a use case. The principal
 * ends up as {@code performed_by} on the audit entry.
 *
 * @param executionId   Unique ID for this execution (generated)
 * @param correlationId ID for tracing across calls (usually from the original request)
 * @param principalId   ID of the principal performing the action
 * @param initiatedAt   When the execution was initiated
 */
public record ExecutionContext(
    String executionId,
    String correlationId,
    String principalId,
    Instant initiatedAt
) {

    /**
     * Create a new execution context for a fresh request.
     * The correlation ID starts out equal to the execution ID.
     */
    public static ExecutionContext create(String principalId) {
        String execId = "exec-" + TsidGenerator.generateRaw();
        return new ExecutionContext(execId, execId, principalId, Instant.now());
    }

    /**
     * Create a new execution context with a correlation ID supplied by the caller.
     */
    public static ExecutionContext withCorrelation(String principalId, String correlationId) {
        if (correlationId == null || correlationId.isBlank()) {
            return create(principalId);
        }
        return new ExecutionContext(
            "exec-" + TsidGenerator.generateRaw(),
            correlationId,
            principalId,
            Instant.now()
        );
    }
}
