package tech.idplane.platform.scope.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * Event type: {@code iam:scope:bulk-deleted}
 */
@Builder
public record ScopesDeleted(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    List<String> scopeIds
) implements ScopeEvent {

    @Override
    public String eventType() {
        return "iam:scope:bulk-deleted";
    }

    @Override
    public String resourceType() {
        return "scope";
    }

    @Override
    public String resourceId() {
        return "*";
    }

    public static ScopesDeletedBuilder fromContext(ExecutionContext ctx) {
        return ScopesDeleted.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
