package tech.idplane.platform.authorization.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:role:created}
 */
@Builder
public record RoleCreated(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String roleId,
    String roleName
) implements AuthorizationEvent {

    @Override
    public String eventType() {
        return "iam:role:created";
    }

    @Override
    public String resourceType() {
        return "role";
    }

    @Override
    public String resourceId() {
        return roleId;
    }

    public static RoleCreatedBuilder fromContext(ExecutionContext ctx) {
        return RoleCreated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
