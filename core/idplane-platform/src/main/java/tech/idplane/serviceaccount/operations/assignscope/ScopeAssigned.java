package tech.idplane.serviceaccount.operations.assignscope;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a scope is granted to a service account.
 *
 * <p>Event type: {@code iam:service-account:scope-assigned}
 */
@Builder
public record ScopeAssigned(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String scopeId,
    String scopeName,
    boolean alreadyAssigned
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:scope-assigned";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static ScopeAssignedBuilder fromContext(ExecutionContext ctx) {
        return ScopeAssigned.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
