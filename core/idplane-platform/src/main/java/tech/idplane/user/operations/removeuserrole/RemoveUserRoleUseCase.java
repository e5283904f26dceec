package tech.idplane.user.operations.removeuserrole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.repository.UserRepository;

import java.util.Map;

/**
 * Revokes a role from a user. Revoking a role the user does not hold is a 404.
 */
@ApplicationScoped
public class RemoveUserRoleUseCase {

    @Inject
    UserRepository userRepository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserRoleRemoved> execute(RemoveUserRoleCommand command, ExecutionContext context) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.failure(UserErrors.userNotFound(command.userId()));
        }
        Role role = roleRepository.findById(command.roleId()).orElse(null);
        if (role == null) {
            return Result.failure(UserErrors.roleNotFound(command.roleId()));
        }
        if (!user.roleIds().contains(role.id)) {
            return Result.failure(new UseCaseError.NotFoundError(
                "ROLE_NOT_ASSIGNED",
                "Role " + role.name + " is not assigned to this user",
                Map.of("userId", user.id, "roleId", role.id)
            ));
        }

        UserRoleRemoved event = UserRoleRemoved.fromContext(context)
            .userId(user.id)
            .roleId(role.id)
            .roleName(role.name)
            .build();

        return unitOfWork.commit(() -> userRepository.removeRole(user.id, role.id), event, command);
    }
}
