package tech.idplane.serviceaccount.operations.removerole;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a role is taken away from a service account.
 *
 * <p>Event type: {@code iam:service-account:role-removed}
 */
@Builder
public record RoleRemoved(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String roleId
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:role-removed";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static RoleRemovedBuilder fromContext(ExecutionContext ctx) {
        return RoleRemoved.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
