package tech.idplane.platform.authorization.events;

import lombok.Builder;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:role:deleted}
 */
@Builder
public record RoleDeleted(
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
        return "iam:role:deleted";
    }

    @Override
    public String resourceType() {
        return "role";
    }

    @Override
    public String resourceId() {
        return roleId;
    }

    public static RoleDeletedBuilder fromContext(ExecutionContext ctx) {
        return RoleDeleted.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
