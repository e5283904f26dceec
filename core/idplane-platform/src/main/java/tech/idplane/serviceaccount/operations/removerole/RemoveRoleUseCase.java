package tech.idplane.serviceaccount.operations.removerole;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.Map;

/**
 * Use case for revoking a role from a service account.
 *
 * <p>Both the account and the role must exist. Revoking a role the account does not
 * hold is a not-found error rather than a silent success. Roles are local only, so
 * nothing is pushed to the authorization server.
 */
@ApplicationScoped
public class RemoveRoleUseCase {

    private static final Logger LOG = Logger.getLogger(RemoveRoleUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Result<RoleRemoved> execute(RemoveRoleCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }
        Role role = roleRepository.findById(command.roleId()).orElse(null);
        if (role == null) {
            return Result.failure(ServiceAccountErrors.roleNotFound(command.roleId()));
        }
        if (!sa.roleIds().contains(role.id)) {
            return Result.failure(new UseCaseError.NotFoundError(
                "ROLE_NOT_ASSIGNED",
                "Role is not assigned to this service account",
                Map.of("serviceAccountId", sa.id, "roleId", role.id)
            ));
        }

        RoleRemoved event = RoleRemoved.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .roleId(role.id)
            .build();

        LOG.debugf("Removing role %s from service account %s", role.name, sa.id);
        return unitOfWork.commit(() -> repository.removeRole(sa.id, role.id), event, command);
    }
}
