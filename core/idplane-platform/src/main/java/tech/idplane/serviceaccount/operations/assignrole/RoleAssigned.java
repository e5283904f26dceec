package tech.idplane.serviceaccount.operations.assignrole;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a role is granted to a service account.
 *
 * <p>Event type: {@code iam:service-account:role-assigned}
 */
@Builder
public record RoleAssigned(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String serviceAccountId,
    String clientId,
    String roleId,
    String roleName,
    boolean alreadyAssigned
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:service-account:role-assigned";
    }

    @Override
    public String resourceType() {
        return "service_account";
    }

    @Override
    public String resourceId() {
        return serviceAccountId;
    }

    public static RoleAssignedBuilder fromContext(ExecutionContext ctx) {
        return RoleAssigned.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
