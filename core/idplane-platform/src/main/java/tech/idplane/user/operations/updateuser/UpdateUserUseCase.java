package tech.idplane.user.operations.updateuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.user.PasswordService;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.operations.UserValidator;
import tech.idplane.user.repository.UserRepository;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Use case for a partial user update.
 *
 * <p>Every check runs before anything is written, so a rejected update leaves the
 * user untouched. On success the returned event describes the stored state.
 */
@ApplicationScoped
public class UpdateUserUseCase {

    @Inject
    UserRepository userRepository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserUpdated> execute(UpdateUserCommand command, ExecutionContext context) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.failure(UserErrors.userNotFound(command.userId()));
        }

        String email = user.email;
        if (command.email() != null) {
            email = UserValidator.normalizeEmail(command.email());
            Optional<UseCaseError> invalid = UserValidator.validateEmail(email);
            if (invalid.isPresent()) {
                return Result.failure(invalid.get());
            }
            if (!email.equals(user.email) && userRepository.existsByEmail(email)) {
                return Result.failure(UserErrors.emailExists(email));
            }
        }
        Optional<UseCaseError> invalidName = UserValidator.validateDisplayName(command.displayName());
        if (invalidName.isPresent()) {
            return Result.failure(invalidName.get());
        }

        String passwordHash = null;
        if (command.password() != null) {
            try {
                passwordHash = passwordService.validateAndHashPassword(command.password());
            } catch (IllegalArgumentException e) {
                return Result.failure(UserErrors.invalidPassword(e.getMessage()));
            }
        }

        List<Role> roles = null;
        if (command.roleIds() != null) {
            List<String> roleIds = List.copyOf(new LinkedHashSet<>(command.roleIds()));
            roles = roleRepository.findByIds(roleIds);
            for (String roleId : roleIds) {
                if (roles.stream().noneMatch(r -> r.id.equals(roleId))) {
                    return Result.failure(UserErrors.roleNotFound(roleId));
                }
            }
        }

        user.email = email;
        if (command.displayName() != null) {
            user.displayName = command.displayName();
        }
        if (passwordHash != null) {
            user.passwordHash = passwordHash;
        }
        if (command.active() != null) {
            user.active = command.active();
        }
        if (command.lockedUntil() != null) {
            user.lockedUntil = command.lockedUntil();
        }
        List<Role> newRoles = roles;
        if (newRoles != null) {
            user.roles = new ArrayList<>(newRoles);
        }

        UserUpdated event = UserUpdated.fromContext(context)
            .userId(user.id)
            .email(user.email)
            .active(user.active)
            .passwordChanged(passwordHash != null)
            .build();

        return unitOfWork.commit(() -> {
            userRepository.update(user);
            if (newRoles != null) {
                userRepository.replaceRoles(user.id, user.roleIds());
            }
        }, event, command);
    }
}
