package tech.idplane.serviceaccount.operations.resyncserviceaccount;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted after a service account was pushed to the authorization server.
 *
 * <p>{@code action} is {@code created} when the client was missing remotely, otherwise {@code updated}.
 *
 * <p>Event type: {@code iam:service-account:resynced}
 */
@Builder
public record ServiceAccountResynced(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String action
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:resynced";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static ServiceAccountResyncedBuilder fromContext(ExecutionContext ctx) {
        return ServiceAccountResynced.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
