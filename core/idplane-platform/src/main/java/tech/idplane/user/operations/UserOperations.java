package tech.idplane.user.operations;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.assignuserrole.AssignUserRoleCommand;
import tech.idplane.user.operations.assignuserrole.AssignUserRoleUseCase;
import tech.idplane.user.operations.assignuserrole.UserRoleAssigned;
import tech.idplane.user.operations.authenticate.AuthenticateUserCommand;
import tech.idplane.user.operations.authenticate.AuthenticateUserUseCase;
import tech.idplane.user.operations.authenticate.UserAuthenticated;
import tech.idplane.user.operations.createuser.CreateUserCommand;
import tech.idplane.user.operations.createuser.CreateUserUseCase;
import tech.idplane.user.operations.createuser.UserCreated;
import tech.idplane.user.operations.deleteuser.DeleteUserCommand;
import tech.idplane.user.operations.deleteuser.DeleteUserUseCase;
import tech.idplane.user.operations.deleteuser.UserDeleted;
import tech.idplane.user.operations.lockuser.LockUserCommand;
import tech.idplane.user.operations.lockuser.LockUserUseCase;
import tech.idplane.user.operations.lockuser.UserLockChanged;
import tech.idplane.user.operations.removeuserrole.RemoveUserRoleCommand;
import tech.idplane.user.operations.removeuserrole.RemoveUserRoleUseCase;
import tech.idplane.user.operations.removeuserrole.UserRoleRemoved;
import tech.idplane.user.operations.resetpassword.PasswordReset;
import tech.idplane.user.operations.resetpassword.ResetPasswordCommand;
import tech.idplane.user.operations.resetpassword.ResetPasswordUseCase;
import tech.idplane.user.operations.updateuser.UpdateUserCommand;
import tech.idplane.user.operations.updateuser.UpdateUserUseCase;
import tech.idplane.user.operations.updateuser.UserUpdated;
import tech.idplane.user.repository.UserRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Facade for user operations. Mutations take an ExecutionContext; queries do not.
 */
@ApplicationScoped
public class UserOperations {

    /**
     * How long the lock endpoint keeps a user out.
     */
    public static final Duration LOCK_DURATION = Duration.ofHours(24);

    @Inject
    CreateUserUseCase createUseCase;

    @Inject
    UpdateUserUseCase updateUseCase;

    @Inject
    DeleteUserUseCase deleteUseCase;

    @Inject
    ResetPasswordUseCase resetPasswordUseCase;

    @Inject
    AssignUserRoleUseCase assignRoleUseCase;

    @Inject
    RemoveUserRoleUseCase removeRoleUseCase;

    @Inject
    LockUserUseCase lockUseCase;

    @Inject
    AuthenticateUserUseCase authenticateUseCase;

    @Inject
    UserRepository repository;

    // ==================== MUTATIONS (require ExecutionContext) ====================

    public Result<UserCreated> create(CreateUserCommand command, ExecutionContext context) {
        return createUseCase.execute(command, context);
    }

    public Result<UserUpdated> update(UpdateUserCommand command, ExecutionContext context) {
        return updateUseCase.execute(command, context);
    }

    public Result<UserDeleted> delete(String userId, ExecutionContext context) {
        return deleteUseCase.execute(new DeleteUserCommand(userId), context);
    }

    public Result<PasswordReset> resetPassword(String userId, String newPassword, ExecutionContext context) {
        return resetPasswordUseCase.execute(new ResetPasswordCommand(userId, newPassword), context);
    }

    public Result<UserRoleAssigned> assignRole(String userId, String roleId, ExecutionContext context) {
        return assignRoleUseCase.execute(new AssignUserRoleCommand(userId, roleId), context);
    }

    public Result<UserRoleRemoved> removeRole(String userId, String roleId, ExecutionContext context) {
        return removeRoleUseCase.execute(new RemoveUserRoleCommand(userId, roleId), context);
    }

    public Result<UserLockChanged> lock(String userId, ExecutionContext context) {
        return lockUseCase.execute(new LockUserCommand(userId, Instant.now().plus(LOCK_DURATION)), context);
    }

    public Result<UserLockChanged> unlock(String userId, ExecutionContext context) {
        return lockUseCase.execute(LockUserCommand.unlock(userId), context);
    }

    /**
     * Check a password sign-in. Failures are {@code AuthenticationError}s.
     */
    public Result<UserAuthenticated> authenticate(String email, String password, ExecutionContext context) {
        return authenticateUseCase.execute(new AuthenticateUserCommand(email, password), context);
    }

    // ==================== QUERIES (no context needed) ====================

    public Optional<User> findById(String id) {
        return repository.findById(id);
    }

    public List<User> list(int skip, int limit) {
        return repository.list(skip, limit);
    }

    public long count() {
        return repository.count();
    }

    public List<User> findByRole(String roleId) {
        return repository.findByRoleId(roleId);
    }
}
