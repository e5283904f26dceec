package tech.idplane.user.operations.authenticate;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event emitted when a user signs in with a correct password.
 *
 * <p>Event type: {@code iam:user:login-succeeded}
 */
@Builder
public record UserAuthenticated(
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
        return "iam:user:login-succeeded";
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String resourceId() {
        return userId;
    }

    public static UserAuthenticatedBuilder fromContext(ExecutionContext ctx) {
        return UserAuthenticated.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
