package tech.idplane.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.events.RoleCreated;
import tech.idplane.platform.authorization.events.RoleDeleted;
import tech.idplane.platform.authorization.events.RoleUpdated;
import tech.idplane.platform.authorization.operations.createrole.CreateRoleCommand;
import tech.idplane.platform.authorization.operations.createrole.CreateRoleUseCase;
import tech.idplane.platform.authorization.operations.deleterole.DeleteRoleCommand;
import tech.idplane.platform.authorization.operations.deleterole.DeleteRoleUseCase;
import tech.idplane.platform.authorization.operations.updaterole.UpdateRoleCommand;
import tech.idplane.platform.authorization.operations.updaterole.UpdateRoleUseCase;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;

import java.util.List;
import java.util.Optional;

/**
 * RoleOperations - Single point of discovery for the Role aggregate.
 *
 * <p>Each write operation takes a command and an execution context and returns a
 * Result containing either the domain event or an error. The entity change and its
 * audit log entry are committed atomically.
 *
 * <p>Read operations do not require execution context and do not emit events.
 */
@ApplicationScoped
public class RoleOperations {

    // ========================================================================
    // Write Operations (Use Cases)
    // ========================================================================

    @Inject
    CreateRoleUseCase createRoleUseCase;

    @Inject
    UpdateRoleUseCase updateRoleUseCase;

    @Inject
    DeleteRoleUseCase deleteRoleUseCase;

    /**
     * Create a new Role.
     *
     * @param command The command containing role details
     * @param context The execution context
     * @return Success with RoleCreated, or Failure with error
     */
    public Result<RoleCreated> createRole(CreateRoleCommand command, ExecutionContext context) {
        return createRoleUseCase.execute(command, context);
    }

    /**
     * Rename a Role or change its description.
     *
     * @param command The command with the fields to change
     * @param context The execution context
     * @return Success with RoleUpdated, or Failure with error
     */
    public Result<RoleUpdated> updateRole(UpdateRoleCommand command, ExecutionContext context) {
        return updateRoleUseCase.execute(command, context);
    }

    /**
     * Delete a Role and remove it from every service account and user.
     *
     * @param command The command identifying the role
     * @param context The execution context
     * @return Success with RoleDeleted, or Failure with error
     */
    public Result<RoleDeleted> deleteRole(DeleteRoleCommand command, ExecutionContext context) {
        return deleteRoleUseCase.execute(command, context);
    }

    // ========================================================================
    // Read Operations (Queries)
    // ========================================================================

    @Inject
    RoleRepository repo;

    public Optional<Role> findById(String id) {
        return repo.findById(id);
    }

    public Optional<Role> findByName(String name) {
        return repo.findByName(name);
    }

    public List<Role> findAll() {
        return repo.listAll();
    }
}
