package tech.idplane.serviceaccount.operations.assignscope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.IdpIntegrationException;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.mapper.RemoteClientMapper;
import tech.idplane.serviceaccount.operations.RemoteFailures;
import tech.idplane.serviceaccount.operations.ServiceAccountAssociations;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Use case for granting a scope to a service account.
 *
 * <p>The scope must apply to the account type. After the local commit the new scope
 * string is pushed to the authorization server; a failed push keeps the local change.
 */
@ApplicationScoped
public class AssignScopeUseCase {

    private static final Logger LOG = Logger.getLogger(AssignScopeUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    ScopeRepository scopeRepository;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopeAssigned> execute(AssignScopeCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }
        Scope scope = scopeRepository.findById(command.scopeId()).orElse(null);
        if (scope == null) {
            return Result.failure(ServiceAccountErrors.scopeNotFound(command.scopeId()));
        }
        if (!scope.isApplicableTo(sa.accountType)) {
            return Result.failure(ServiceAccountAssociations.notApplicable(scope, sa.accountType));
        }

        boolean alreadyAssigned = sa.scopeIds().contains(scope.id);
        ScopeAssigned event = ScopeAssigned.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .scopeId(scope.id)
            .scopeName(scope.name)
            .alreadyAssigned(alreadyAssigned)
            .build();

        if (alreadyAssigned) {
            LOG.debugf("Scope %s already assigned to service account %s", scope.name, sa.id);
            return Result.success(event);
        }

        Result<ScopeAssigned> committed =
            unitOfWork.commit(() -> repository.assignScope(sa.id, scope.id), event, command);
        if (committed.isFailure() || !command.syncToIdp()) {
            return committed;
        }

        List<Scope> held = new ArrayList<>(sa.scopes);
        held.add(scope);
        held.sort(Comparator.comparing((Scope s) -> s.name));
        sa.scopes = held;
        try {
            idpClient.updateClient(sa.clientId, RemoteClientMapper.toRemoteClient(sa));
            return committed;
        } catch (IdpIntegrationException e) {
            LOG.warnf("Scope %s assigned to %s locally but client %s was not updated: %s",
                scope.name, sa.id, sa.clientId, e.getMessage());
            return Result.failure(RemoteFailures.of("IDP_UPDATE_FAILED", sa.clientId, e, true));
        }
    }
}
