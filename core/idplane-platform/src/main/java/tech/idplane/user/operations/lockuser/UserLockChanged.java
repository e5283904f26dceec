package tech.idplane.user.operations.lockuser;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a user is locked or unlocked. A null {@code lockedUntil} means unlocked.
 *
 * <p>Event type: {@code iam:user:lock-changed}
 */
@Builder
public record UserLockChanged(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String userId,
    String email,
    Instant lockedUntil
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:user:lock-changed";
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String resourceId() {
        return userId;
    }

    public static UserLockChangedBuilder fromContext(ExecutionContext ctx) {
        return UserLockChanged.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
