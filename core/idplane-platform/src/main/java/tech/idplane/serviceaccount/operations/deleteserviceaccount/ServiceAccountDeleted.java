package tech.idplane.serviceaccount.operations.deleteserviceaccount;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a service account is deleted locally.
 *
 * <p>Event type: {@code iam:service-account:deleted}
 *
 * @param remoteDeleted  whether the client is known to be gone from the authorization server
 * @param remoteError    message of the failed remote delete, if any
 */
@Builder
public record ServiceAccountDeleted(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    boolean remoteDeleted,
    String remoteError
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:deleted";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static ServiceAccountDeletedBuilder fromContext(ExecutionContext ctx) {
        return ServiceAccountDeleted.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
