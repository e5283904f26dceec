package tech.idplane.serviceaccount.operations.resyncserviceaccount;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.IdpIntegrationException;
import tech.idplane.platform.idp.RemoteClient;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.mapper.RemoteClientMapper;
import tech.idplane.serviceaccount.operations.RemoteFailures;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

/**
 * Use case for re-pushing one service account to the authorization server.
 *
 * <p>Creates the client when the server does not know it, otherwise overwrites it
 * with the locally derived client. Local state is not changed; the outcome is audited.
 */
@ApplicationScoped
public class ResyncServiceAccountUseCase {

    private static final Logger LOG = Logger.getLogger(ResyncServiceAccountUseCase.class);

    static final String ACTION_CREATED = "created";
    static final String ACTION_UPDATED = "updated";

    @Inject
    ServiceAccountRepository repository;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ServiceAccountResynced> execute(ResyncServiceAccountCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }

        RemoteClient desired = RemoteClientMapper.toRemoteClient(sa);
        String action;
        try {
            if (idpClient.getClient(sa.clientId).isPresent()) {
                idpClient.updateClient(sa.clientId, desired);
                action = ACTION_UPDATED;
            } else {
                idpClient.createClient(desired);
                action = ACTION_CREATED;
            }
        } catch (IdpIntegrationException e) {
            LOG.warnf("Resync of service account %s (client %s) failed: %s", sa.id, sa.clientId, e.getMessage());
            return Result.failure(RemoteFailures.of("IDP_SYNC_FAILED", sa.clientId, e, true));
        }

        LOG.infof("Service account %s resynced, client %s %s", sa.id, sa.clientId, action);
        ServiceAccountResynced event = ServiceAccountResynced.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .action(action)
            .build();
        return unitOfWork.commit(() -> { }, event, command);
    }
}
