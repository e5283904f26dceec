package tech.idplane.user.operations.lockuser;

import java.time.Instant;

/**
 * Lock a user until the given instant, or unlock when {@code lockedUntil} is null.
 */
public record LockUserCommand(String userId, Instant lockedUntil) {

    public static LockUserCommand unlock(String userId) {
        return new LockUserCommand(userId, null);
    }
}
