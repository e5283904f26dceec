package tech.idplane.serviceaccount.operations.assignrole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

/**
 * Use case for granting a role to a service account.
 *
 * <p>Granting a role the account already holds succeeds without writing anything.
 */
@ApplicationScoped
public class AssignRoleUseCase {

    private static final Logger LOG = Logger.getLogger(AssignRoleUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RoleAssigned> execute(AssignRoleCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }
        Role role = roleRepository.findById(command.roleId()).orElse(null);
        if (role == null) {
            return Result.failure(ServiceAccountErrors.roleNotFound(command.roleId()));
        }

        boolean alreadyAssigned = sa.roleIds().contains(role.id);
        RoleAssigned event = RoleAssigned.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .roleId(role.id)
            .roleName(role.name)
            .alreadyAssigned(alreadyAssigned)
            .build();

        if (alreadyAssigned) {
            LOG.debugf("Role %s already assigned to service account %s", role.name, sa.id);
            return Result.success(event);
        }
        return unitOfWork.commit(() -> repository.assignRole(sa.id, role.id), event, command);
    }
}
