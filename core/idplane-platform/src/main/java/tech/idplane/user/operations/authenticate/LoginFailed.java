package tech.idplane.user.operations.authenticate;

import lombok.Builder;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Event type: {@code iam:user:login-failed}
 */
@Builder
public record LoginFailed(
    String eventId,
    Instant time,
    String executionId,
    String correlationId,
    String principalId,
    String userId,
    String email,
    int failedLoginAttempts
) implements DomainEvent {

    @Override
    public String eventType() {
        return "iam:user:login-failed";
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public String resourceId() {
        return userId;
    }

    public static LoginFailedBuilder fromContext(ExecutionContext ctx) {
        return LoginFailed.builder()
            .eventId(TsidGenerator.generateRaw())
            .time(Instant.now())
            .executionId(ctx.executionId())
            .correlationId(ctx.correlationId())
            .principalId(ctx.principalId());
    }
}
