package tech.idplane.serviceaccount.operations.createserviceaccount;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a freshly created service account is removed again because
 * the authorization server refused or could not be reached.
 *
 * <p>Event type: {@code iam:service-account:creation-rolled-back}
 */
@Builder
public record ServiceAccountCreationRolledBack(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String reason
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:creation-rolled-back";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static ServiceAccountCreationRolledBackBuilder fromContext(ExecutionContext ctx) {
        return ServiceAccountCreationRolledBack.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
