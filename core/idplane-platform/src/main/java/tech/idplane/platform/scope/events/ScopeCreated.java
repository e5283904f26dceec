package tech.idplane.platform.scope.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:scope:created}
 */
@Builder
public record ScopeCreated(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String scopeId,
    String scopeName
) implements ScopeEvent {

    @Override
    public String eventType() {
        return "iam:scope:created";
    }

    @Override
    public String resourceType() {
        return "scope";
    }

    @Override
    public String resourceId() {
        return scopeId;
    }

    public static ScopeCreatedBuilder fromContext(ExecutionContext ctx) {
        return ScopeCreated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
