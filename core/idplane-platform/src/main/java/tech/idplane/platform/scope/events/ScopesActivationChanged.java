package tech.idplane.platform.scope.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * Event emitted when several scopes are switched on or off at once. Only the ids
 * that existed are listed.
 *
 * <p>Event type: {@code iam:scope:bulk-activation-changed}
 */
@Builder
public record ScopesActivationChanged(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    List<String> scopeIds,
    boolean active
) implements ScopeEvent {

    @Override
    public String eventType() {
        return "iam:scope:bulk-activation-changed";
    }

    @Override
    public String resourceType() {
        return "scope";
    }

    @Override
    public String resourceId() {
        return "*";
    }

    public static ScopesActivationChangedBuilder fromContext(ExecutionContext ctx) {
        return ScopesActivationChanged.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
