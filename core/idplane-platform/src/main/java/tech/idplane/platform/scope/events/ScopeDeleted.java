package tech.idplane.platform.scope.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:scope:deleted}
 */
@Builder
public record ScopeDeleted(
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
        return "iam:scope:deleted";
    }

    @Override
    public String resourceType() {
        return "scope";
    }

    @Override
    public String resourceId() {
        return scopeId;
    }

    public static ScopeDeletedBuilder fromContext(ExecutionContext ctx) {
        return ScopeDeleted.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
