package tech.idplane.serviceaccount.operations.createserviceaccount;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.IdpIntegrationException;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.shared.EntityType;
import tech.idplane.platform.shared.TsidGenerator;
import tech.idplane.serviceaccount.entity.AccountType;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.mapper.RemoteClientMapper;
import tech.idplane.serviceaccount.operations.RemoteFailures;
import tech.idplane.serviceaccount.operations.ServiceAccountAssociations;
import tech.idplane.serviceaccount.operations.ServiceAccountValidator;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Use case for creating a service account and registering its OAuth2 client.
 *
 * <p>The local row (with its role and scope associations) is committed first, then
 * the client is created in the authorization server. If the remote create fails the
 * local row is deleted again by a compensating commit, so no account exists locally
 * without a registered client.
 */
@ApplicationScoped
public class CreateServiceAccountUseCase {

    private static final Logger LOG = Logger.getLogger(CreateServiceAccountUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    ServiceAccountAssociations associations;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ServiceAccountCreated> execute(CreateServiceAccountCommand command, ExecutionContext context) {
        Optional<UseCaseError> invalid = ServiceAccountValidator.firstError(
            ServiceAccountValidator.requireIdentifier("clientId", command.clientId()),
            ServiceAccountValidator.requireIdentifier("clientName", command.clientName()),
            ServiceAccountValidator.requireIdentifier("createdBy", command.createdBy()),
            ServiceAccountValidator.checkGrantTypes(command.grantTypes()),
            ServiceAccountValidator.checkAuthMethod(command.tokenEndpointAuthMethod())
        );
        if (invalid.isPresent()) {
            return Result.failure(invalid.get());
        }

        if (repository.existsByClientId(command.clientId())) {
            return Result.failure(new UseCaseError.ConflictError(
                "CLIENT_ID_EXISTS",
                "Service account with client_id '" + command.clientId() + "' already exists",
                Map.of("clientId", command.clientId())
            ));
        }

        AccountType accountType = command.accountType() != null ? command.accountType() : AccountType.SERVICE_TO_SERVICE;

        Result<List<Role>> roles = associations.resolveRoles(command.roleIds());
        if (roles instanceof Result.Failure<List<Role>> f) {
            return Result.failure(f.error());
        }
        Result<List<Scope>> scopes = associations.resolveScopes(command.scopeIds(), accountType);
        if (scopes instanceof Result.Failure<List<Scope>> f) {
            return Result.failure(f.error());
        }

        ServiceAccount sa = newServiceAccount(command, accountType);
        sa.roles = new ArrayList<>(((Result.Success<List<Role>>) roles).value());
        sa.scopes = new ArrayList<>(((Result.Success<List<Scope>>) scopes).value());

        ServiceAccountCreated event = ServiceAccountCreated.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .clientName(sa.clientName)
            .build();

        Result<ServiceAccountCreated> committed = unitOfWork.commit(() -> repository.persist(sa), event, command);
        if (committed.isFailure() || !command.syncToIdp()) {
            return committed;
        }

        try {
            idpClient.createClient(RemoteClientMapper.toRemoteClient(sa));
            LOG.infof("Service account %s registered as client %s", sa.id, sa.clientId);
            return committed;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to register client %s, removing local service account %s: %s",
                sa.clientId, sa.id, e.getMessage());
            boolean rolledBack = rollback(sa, command, context, e);
            IdpIntegrationException failure = e instanceof IdpIntegrationException idpFailure
                ? idpFailure
                : new IdpIntegrationException("Failed to register client " + sa.clientId + ": " + e.getMessage(), e);
            var error = RemoteFailures.of("IDP_CREATE_FAILED", sa.clientId, failure, false);
            if (!rolledBack) {
                Map<String, Object> details = new LinkedHashMap<>(error.details());
                details.put("rollbackFailed", true);
                return Result.failure(new UseCaseError.RemoteIntegrationError(error.code(), error.message(), details));
            }
            return Result.failure(error);
        }
    }

    private boolean rollback(ServiceAccount sa, CreateServiceAccountCommand command,
                             ExecutionContext context, RuntimeException cause) {
        ServiceAccountCreationRolledBack event = ServiceAccountCreationRolledBack.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .reason(String.valueOf(cause.getMessage()))
            .build();

        Result<ServiceAccountCreationRolledBack> result =
            unitOfWork.commit(() -> repository.deleteWithAssociations(sa.id), event, command);
        if (result instanceof Result.Failure<ServiceAccountCreationRolledBack> f) {
            LOG.errorf("Rollback of service account %s failed: %s", sa.id, f.error().message());
            return false;
        }
        return true;
    }

    private static ServiceAccount newServiceAccount(CreateServiceAccountCommand command, AccountType accountType) {
        ServiceAccount sa = new ServiceAccount();
        sa.id = TsidGenerator.generate(EntityType.SERVICE_ACCOUNT);
        sa.clientId = command.clientId();
        sa.clientSecret = command.clientSecret();
        sa.clientName = command.clientName();
        sa.description = command.description();
        sa.accountType = accountType;
        if (command.grantTypes() != null) {
            sa.grantTypes = new ArrayList<>(command.grantTypes());
        }
        if (command.responseTypes() != null) {
            sa.responseTypes = new ArrayList<>(command.responseTypes());
        }
        if (command.tokenEndpointAuthMethod() != null) {
            sa.tokenEndpointAuthMethod = command.tokenEndpointAuthMethod();
        }
        sa.tokenEndpointAuthSigningAlg = command.tokenEndpointAuthSigningAlg();
        sa.audience = listOrEmpty(command.audience());
        sa.redirectUris = listOrEmpty(command.redirectUris());
        sa.postLogoutRedirectUris = listOrEmpty(command.postLogoutRedirectUris());
        sa.allowedCorsOrigins = listOrEmpty(command.allowedCorsOrigins());
        if (command.skipConsent() != null) {
            sa.skipConsent = command.skipConsent();
        }
        sa.owner = command.owner();
        if (command.clientMetadata() != null) {
            sa.clientMetadata = new LinkedHashMap<>(command.clientMetadata());
        }
        sa.jwks = command.jwks();
        sa.jwksUri = command.jwksUri();
        if (command.idTokenSignedResponseAlg() != null) {
            sa.idTokenSignedResponseAlg = command.idTokenSignedResponseAlg();
        }
        sa.active = true;
        sa.createdBy = command.createdBy();
        return sa;
    }

    private static List<String> listOrEmpty(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
