package tech.idplane.serviceaccount.operations.updateserviceaccount;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a service account's local record changes.
 *
 * <p>Event type: {@code iam:service-account:updated}
 */
@Builder
public record ServiceAccountUpdated(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    boolean active
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:updated";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static ServiceAccountUpdatedBuilder fromContext(ExecutionContext ctx) {
        return ServiceAccountUpdated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
