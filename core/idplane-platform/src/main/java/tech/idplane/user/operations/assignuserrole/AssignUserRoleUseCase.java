package tech.idplane.user.operations.assignuserrole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.repository.UserRepository;

/**
 * Grants a role to a user. Granting a held role succeeds without writing.
 */
@ApplicationScoped
public class AssignUserRoleUseCase {

    @Inject
    UserRepository userRepository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserRoleAssigned> execute(AssignUserRoleCommand command, ExecutionContext context) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.failure(UserErrors.userNotFound(command.userId()));
        }
        Role role = roleRepository.findById(command.roleId()).orElse(null);
        if (role == null) {
            return Result.failure(UserErrors.roleNotFound(command.roleId()));
        }

        boolean alreadyAssigned = user.roleIds().contains(role.id);
        UserRoleAssigned event = UserRoleAssigned.fromContext(context)
            .userId(user.id)
            .roleId(role.id)
            .roleName(role.name)
            .alreadyAssigned(alreadyAssigned)
            .build();

        if (alreadyAssigned) {
            return Result.success(event);
        }
        return unitOfWork.commit(() -> userRepository.assignRole(user.id, role.id), event, command);
    }
}
