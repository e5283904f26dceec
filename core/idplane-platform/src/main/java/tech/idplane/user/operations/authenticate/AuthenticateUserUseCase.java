package tech.idplane.user.operations.authenticate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.user.PasswordService;
import tech.idplane.user.entity.User;
import tech.idplane.user.repository.UserRepository;

import java.time.Instant;
import java.util.Map;

/**
 * Checks an email and password pair.
 *
 * <p>A disabled or locked account is refused before the password is looked at. A
 * wrong password bumps the failed attempt counter; a correct one resets it, stamps
 * the last login time and upgrades a hash written with older parameters. Unknown
 * emails and wrong passwords produce the same error.
 */
@ApplicationScoped
public class AuthenticateUserUseCase {

    private static final Logger LOG = Logger.getLogger(AuthenticateUserUseCase.class);

    static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";

    @Inject
    UserRepository userRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserAuthenticated> execute(AuthenticateUserCommand command, ExecutionContext context) {
        User user = userRepository.findByEmail(command.email()).orElse(null);
        if (user == null) {
            LOG.infof("Login failed: no user for email %s", command.email());
            return Result.failure(invalidCredentials());
        }

        Instant now = Instant.now();
        if (!user.active) {
            LOG.infof("Login refused: user %s is disabled", user.email);
            return Result.failure(new UseCaseError.AuthenticationError(
                "ACCOUNT_DISABLED", "Account is disabled", Map.of()));
        }
        if (user.isLocked(now)) {
            LOG.infof("Login refused: user %s is locked until %s", user.email, user.lockedUntil);
            return Result.failure(new UseCaseError.AuthenticationError(
                "ACCOUNT_LOCKED", "Account is locked", Map.of("lockedUntil", user.lockedUntil.toString())));
        }

        if (!passwordService.verifyPassword(command.password(), user.passwordHash)) {
            user.failedLoginAttempts++;
            LoginFailed failed = LoginFailed.fromContext(context)
                .userId(user.id)
                .email(user.email)
                .failedLoginAttempts(user.failedLoginAttempts)
                .build();
            Result<LoginFailed> recorded = unitOfWork.commit(() -> userRepository.update(user), failed, command);
            if (recorded instanceof Result.Failure<LoginFailed> f) {
                LOG.warnf("Could not record failed login for %s: %s", user.email, f.error().message());
            }
            LOG.infof("Login failed: wrong password for %s (%d attempt(s))", user.email, user.failedLoginAttempts);
            return Result.failure(invalidCredentials());
        }

        user.failedLoginAttempts = 0;
        user.lastLoginAt = now;
        if (passwordService.needsRehash(user.passwordHash)) {
            user.passwordHash = passwordService.hashPassword(command.password());
        }

        UserAuthenticated event = UserAuthenticated.fromContext(context)
            .userId(user.id)
            .email(user.email)
            .build();
        return unitOfWork.commit(() -> userRepository.update(user), event, command);
    }

    private static UseCaseError invalidCredentials() {
        return new UseCaseError.AuthenticationError(INVALID_CREDENTIALS, "Invalid email or password", Map.of());
    }
}
