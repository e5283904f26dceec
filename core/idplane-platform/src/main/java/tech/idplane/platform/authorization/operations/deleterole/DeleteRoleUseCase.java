package tech.idplane.platform.authorization.operations.deleterole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.authorization.events.RoleDeleted;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Use case for deleting a Role. Service accounts holding it lose the grant.
 */
@ApplicationScoped
public class DeleteRoleUseCase {

    @Inject
    RoleRepository roleRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RoleDeleted> execute(DeleteRoleCommand command, ExecutionContext context) {
        Role role = roleRepo.findById(command.roleId()).orElse(null);

        if (role == null) {
            return Result.failure(new UseCaseError.NotFoundError(
                "ROLE_NOT_FOUND",
                "Role not found",
                Map.of("roleId", String.valueOf(command.roleId()))
            ));
        }

        // Create domain event (before deletion)
        RoleDeleted event = RoleDeleted.fromContext(context)
            .roleId(role.id)
            .roleName(role.name)
            .build();

        return unitOfWork.commit(() -> roleRepo.deleteWithAssignments(role.id), event, command);
    }
}
