package tech.idplane.serviceaccount.operations.createserviceaccount;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a service account is stored locally.
 *
 * <p>Event type: {@code iam:service-account:created}
 */
@Builder
public record ServiceAccountCreated(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String clientName
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:created";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    /**
     * Create a pre-configured builder with event metadata from the execution context.
     */
    public static ServiceAccountCreatedBuilder fromContext(ExecutionContext ctx) {
        return ServiceAccountCreated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
