package tech.idplane.serviceaccount.operations.removescope;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a scope is taken away from a service account.
 *
 * <p>Event type: {@code iam:service-account:scope-removed}
 */
@Builder
public record ScopeRemoved(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String scopeId
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:scope-removed";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static ScopeRemovedBuilder fromContext(ExecutionContext ctx) {
        return ScopeRemoved.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
