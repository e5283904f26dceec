package tech.idplane.platform.authorization.operations.updaterole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.authorization.events.RoleUpdated;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Use case for updating a Role. Holders keep the role under its new name.
 */
@ApplicationScoped
public class UpdateRoleUseCase {

    @Inject
    RoleRepository roleRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RoleUpdated> execute(UpdateRoleCommand command, ExecutionContext context) {
        Role role = roleRepo.findById(command.roleId()).orElse(null);
        if (role == null) {
            return Result.failure(new UseCaseError.NotFoundError(
                "ROLE_NOT_FOUND",
                "Role not found",
                Map.of("roleId", String.valueOf(command.roleId()))
            ));
        }

        if (command.name() != null) {
            if (command.name().isBlank()) {
                return Result.failure(new UseCaseError.ValidationError(
                    "NAME_REQUIRED",
                    "Role name must not be blank",
                    Map.of()
                ));
            }
            if (command.name().length() > 100) {
                return Result.failure(new UseCaseError.ValidationError(
                    "NAME_TOO_LONG",
                    "Role name must be at most 100 characters",
                    Map.of("length", command.name().length())
                ));
            }
            if (!command.name().equals(role.name)
                    && roleRepo.findByName(command.name()).filter(other -> !other.id.equals(role.id)).isPresent()) {
                return Result.failure(new UseCaseError.ConflictError(
                    "ROLE_EXISTS",
                    "Role with name '" + command.name() + "' already exists",
                    Map.of("roleName", command.name())
                ));
            }
            role.name = command.name();
        }
        if (command.description() != null) {
            role.description = command.description();
        }

        RoleUpdated event = RoleUpdated.fromContext(context)
            .roleId(role.id)
            .roleName(role.name)
            .build();

        return unitOfWork.commit(() -> roleRepo.update(role), event, command);
    }
}
