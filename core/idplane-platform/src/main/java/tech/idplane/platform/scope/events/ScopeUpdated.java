package tech.idplane.platform.scope.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:scope:updated}
 */
@Builder
public record ScopeUpdated(
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
        return "iam:scope:updated";
    }

    @Override
    public String resourceType() {
        return "scope";
    }

    @Override
    public String resourceId() {
        return scopeId;
    }

    public static ScopeUpdatedBuilder fromContext(ExecutionContext ctx) {
        return ScopeUpdated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
