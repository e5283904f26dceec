package tech.idplane.serviceaccount.operations.removescope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.IdpIntegrationException;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.mapper.RemoteClientMapper;
import tech.idplane.serviceaccount.operations.RemoteFailures;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.Map;

/**
 * Use case for revoking a scope from a service account, then pushing the reduced
 * scope string to the authorization server.
 */
@ApplicationScoped
public class RemoveScopeUseCase {

    private static final Logger LOG = Logger.getLogger(RemoveScopeUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    ScopeRepository scopeRepository;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopeRemoved> execute(RemoveScopeCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }
        Scope scope = scopeRepository.findById(command.scopeId()).orElse(null);
        if (scope == null) {
            return Result.failure(ServiceAccountErrors.scopeNotFound(command.scopeId()));
        }
        if (!sa.scopeIds().contains(scope.id)) {
            return Result.failure(new UseCaseError.NotFoundError(
                "SCOPE_NOT_ASSIGNED",
                "Scope is not assigned to this service account",
                Map.of("serviceAccountId", sa.id, "scopeId", scope.id)
            ));
        }

        ScopeRemoved event = ScopeRemoved.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .scopeId(scope.id)
            .build();

        Result<ScopeRemoved> committed =
            unitOfWork.commit(() -> repository.removeScope(sa.id, scope.id), event, command);
        if (committed.isFailure() || !command.syncToIdp()) {
            return committed;
        }

        sa.scopes = sa.scopes.stream().filter(s -> !scope.id.equals(s.id)).toList();
        try {
            idpClient.updateClient(sa.clientId, RemoteClientMapper.toRemoteClient(sa));
            return committed;
        } catch (IdpIntegrationException e) {
            LOG.warnf("Scope %s removed from %s locally but client %s was not updated: %s",
                scope.name, sa.id, sa.clientId, e.getMessage());
            return Result.failure(RemoteFailures.of("IDP_UPDATE_FAILED", sa.clientId, e, true));
        }
    }
}
