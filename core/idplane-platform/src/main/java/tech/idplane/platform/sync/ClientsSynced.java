package tech.idplane.platform.sync;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event recorded once per reconciliation pass.
 *
 * <p>Event type: {@code iam:clients:synced}
 */
@Builder
public record ClientsSynced(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    boolean success,
    int clientsCreated,
    int clientsUpdated,
    int clientsDeleted,
    int errors
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:clients:synced";
    }

    @Override
    public String resourceType() {
        return "oauth2_client";
    }

    @Override
    public String resourceId() {
        return "*";
    }

    public static ClientsSyncedBuilder fromContext(ExecutionContext ctx) {
        return ClientsSynced.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
