package tech.idplane.user.operations.removeuserrole;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:user:role-removed}
 */
@Builder
public record UserRoleRemoved(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String userId,
    String roleId,
    String roleName
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:user:role-removed";
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String resourceId() {
        return userId;
    }

    public static UserRoleRemovedBuilder fromContext(ExecutionContext ctx) {
        return UserRoleRemoved.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
