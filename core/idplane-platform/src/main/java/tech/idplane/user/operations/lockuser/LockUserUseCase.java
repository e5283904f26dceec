package tech.idplane.user.operations.lockuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.repository.UserRepository;

/**
 * Locks or unlocks a user. Unlocking also clears the failed attempt counter.
 */
@ApplicationScoped
public class LockUserUseCase {

    private static final Logger LOG = Logger.getLogger(LockUserUseCase.class);

    @Inject
    UserRepository userRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserLockChanged> execute(LockUserCommand command, ExecutionContext context) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.failure(UserErrors.userNotFound(command.userId()));
        }

        user.lockedUntil = command.lockedUntil();
        if (command.lockedUntil() == null) {
            user.failedLoginAttempts = 0;
        }

        UserLockChanged event = UserLockChanged.fromContext(context)
            .userId(user.id)
            .email(user.email)
            .lockedUntil(user.lockedUntil)
            .build();

        Result<UserLockChanged> result = unitOfWork.commit(() -> userRepository.update(user), event, command);
        if (result.isSuccess()) {
            LOG.infof("User %s %s", user.email,
                user.lockedUntil == null ? "unlocked" : "locked until " + user.lockedUntil);
        }
        return result;
    }
}
