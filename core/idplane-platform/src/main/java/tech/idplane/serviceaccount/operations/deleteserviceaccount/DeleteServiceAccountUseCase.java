package tech.idplane.serviceaccount.operations.deleteserviceaccount;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.IdpIntegrationException;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

/**
 * Use case for deleting a service account.
 *
 * <p>The remote delete is best effort: a failure is logged and recorded on the
 * event, and the local delete (associations first, then the row) always proceeds.
 */
@ApplicationScoped
public class DeleteServiceAccountUseCase {

    private static final Logger LOG = Logger.getLogger(DeleteServiceAccountUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ServiceAccountDeleted> execute(DeleteServiceAccountCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }

        boolean remoteDeleted = false;
        String remoteError = null;
        if (command.syncToIdp()) {
            try {
                remoteDeleted = idpClient.deleteClient(sa.clientId);
            } catch (IdpIntegrationException e) {
                remoteError = e.getMessage();
                LOG.warnf("Could not delete client %s from authorization server, deleting locally anyway: %s",
                    sa.clientId, e.getMessage());
            }
        }

        ServiceAccountDeleted event = ServiceAccountDeleted.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .remoteDeleted(remoteDeleted)
            .remoteError(remoteError)
            .build();

        Result<ServiceAccountDeleted> result =
            unitOfWork.commit(() -> repository.deleteWithAssociations(sa.id), event, command);
        if (result.isSuccess()) {
            LOG.infof("Service account %s (client %s) deleted", sa.id, sa.clientId);
        }
        return result;
    }
}
