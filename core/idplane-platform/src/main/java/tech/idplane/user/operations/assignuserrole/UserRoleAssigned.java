package tech.idplane.user.operations.assignuserrole;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:user:role-assigned}
 */
@Builder
public record UserRoleAssigned(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String userId,
    String roleId,
    String roleName,
    boolean alreadyAssigned
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:user:role-assigned";
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String resourceId() {
        return userId;
    }

    public static UserRoleAssignedBuilder fromContext(ExecutionContext ctx) {
        return UserRoleAssigned.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
