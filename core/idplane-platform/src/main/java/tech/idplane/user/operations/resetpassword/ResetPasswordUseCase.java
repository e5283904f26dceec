package tech.idplane.user.operations.resetpassword;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.user.PasswordService;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.repository.UserRepository;

/**
 * Administrative password reset. The failed attempt counter starts over; an
 * explicit lock stays in place.
 */
@ApplicationScoped
public class ResetPasswordUseCase {

    private static final Logger LOG = Logger.getLogger(ResetPasswordUseCase.class);

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<PasswordReset> execute(ResetPasswordCommand command, ExecutionContext context) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.failure(UserErrors.userNotFound(command.userId()));
        }

        try {
            user.passwordHash = passwordService.validateAndHashPassword(command.newPassword());
        } catch (IllegalArgumentException e) {
            return Result.failure(UserErrors.invalidPassword(e.getMessage()));
        }
        user.failedLoginAttempts = 0;

        PasswordReset event = PasswordReset.fromContext(context)
            .userId(user.id)
            .email(user.email)
            .build();

        Result<PasswordReset> result = unitOfWork.commit(() -> userRepository.update(user), event, command);
        if (result.isSuccess()) {
            LOG.infof("Password reset for user %s by %s", user.email, context.principalId());
        }
        return result;
    }
}
