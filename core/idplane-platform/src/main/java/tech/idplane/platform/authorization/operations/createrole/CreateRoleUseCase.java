package tech.idplane.platform.authorization.operations.createrole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.authorization.events.RoleCreated;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.shared.EntityType;
import tech.idplane.platform.shared.TsidGenerator;

import java.util.Map;

/**
 * Use case for creating a Role.
 */
@ApplicationScoped
public class CreateRoleUseCase {

    @Inject
    RoleRepository roleRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RoleCreated> execute(CreateRoleCommand command, ExecutionContext context) {
        if (command.name() == null || command.name().isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                "NAME_REQUIRED",
                "Role name is required",
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

        if (roleRepo.findByName(command.name()).isPresent()) {
            return Result.failure(new UseCaseError.ConflictError(
                "ROLE_EXISTS",
                "Role with name '" + command.name() + "' already exists",
                Map.of("roleName", command.name())
            ));
        }

        Role role = new Role(TsidGenerator.generate(EntityType.ROLE), command.name(), command.description());

        RoleCreated event = RoleCreated.fromContext(context)
            .roleId(role.id)
            .roleName(role.name)
            .build();

        return unitOfWork.commit(() -> roleRepo.persist(role), event, command);
    }
}
