package tech.idplane.user.operations.createuser;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:user:created}
 */
@Builder
public record UserCreated(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String userId,
    String email
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:user:created";
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String resourceId() {
        return userId;
    }

    public static UserCreatedBuilder fromContext(ExecutionContext ctx) {
        return UserCreated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
