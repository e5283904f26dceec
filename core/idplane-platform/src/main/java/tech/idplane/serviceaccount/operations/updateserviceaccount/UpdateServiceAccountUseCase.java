package tech.idplane.serviceaccount.operations.updateserviceaccount;

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
import tech.idplane.serviceaccount.entity.AccountType;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.mapper.RemoteClientMapper;
import tech.idplane.serviceaccount.operations.RemoteFailures;
import tech.idplane.serviceaccount.operations.ServiceAccountAssociations;
import tech.idplane.serviceaccount.operations.ServiceAccountValidator;
import tech.idplane.serviceaccount.operations.ServiceAccountErrors;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Use case for updating a service account.
 *
 * <p>Association replacement and field updates are committed together, then the
 * derived client is pushed to the authorization server. A failed push does NOT undo
 * the local commit: the caller gets a remote integration error while the database
 * already holds the new values, and a later resync brings the server in line.
 */
@ApplicationScoped
public class UpdateServiceAccountUseCase {

    private static final Logger LOG = Logger.getLogger(UpdateServiceAccountUseCase.class);

    @Inject
    ServiceAccountRepository repository;

    @Inject
    ServiceAccountAssociations associations;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ServiceAccountUpdated> execute(UpdateServiceAccountCommand command, ExecutionContext context) {
        ServiceAccount sa = repository.findById(command.serviceAccountId()).orElse(null);
        if (sa == null) {
            return Result.failure(ServiceAccountErrors.accountNotFound(command.serviceAccountId()));
        }

        Optional<UseCaseError> invalid = ServiceAccountValidator.firstError(
            ServiceAccountValidator.checkName(command.clientName()),
            ServiceAccountValidator.checkGrantTypes(command.grantTypes()),
            ServiceAccountValidator.checkAuthMethod(command.tokenEndpointAuthMethod())
        );
        if (invalid.isPresent()) {
            return Result.failure(invalid.get());
        }

        AccountType accountType = command.accountType() != null ? command.accountType() : sa.accountType;

        List<Role> roles = sa.roles;
        if (command.roleIds() != null) {
            Result<List<Role>> resolved = associations.resolveRoles(command.roleIds());
            if (resolved instanceof Result.Failure<List<Role>> f) {
                return Result.failure(f.error());
            }
            roles = ((Result.Success<List<Role>>) resolved).value();
        }

        List<Scope> scopes = sa.scopes;
        if (command.scopeIds() != null) {
            Result<List<Scope>> resolved = associations.resolveScopes(command.scopeIds(), accountType);
            if (resolved instanceof Result.Failure<List<Scope>> f) {
                return Result.failure(f.error());
            }
            scopes = ((Result.Success<List<Scope>>) resolved).value();
        } else if (accountType != sa.accountType) {
            for (Scope scope : sa.scopes) {
                if (!scope.isApplicableTo(accountType)) {
                    return Result.failure(ServiceAccountAssociations.notApplicable(scope, accountType));
                }
            }
        }

        applyChanges(sa, command, accountType);
        sa.roles = new ArrayList<>(roles);
        sa.scopes = new ArrayList<>(scopes);

        ServiceAccountUpdated event = ServiceAccountUpdated.fromContext(context)
            .serviceAccountId(sa.id)
            .clientId(sa.clientId)
            .active(sa.active)
            .build();

        Result<ServiceAccountUpdated> committed = unitOfWork.commit(() -> {
            if (command.roleIds() != null) {
                repository.replaceRoles(sa.id, command.roleIds());
            }
            if (command.scopeIds() != null) {
                repository.replaceScopes(sa.id, command.scopeIds());
            }
            repository.update(sa);
        }, event, command);

        if (committed.isFailure() || !command.syncToIdp()) {
            return committed;
        }

        try {
            idpClient.updateClient(sa.clientId, RemoteClientMapper.toRemoteClient(sa));
            LOG.infof("Service account %s updated and pushed to client %s", sa.id, sa.clientId);
            return committed;
        } catch (IdpIntegrationException e) {
            LOG.warnf("Service account %s updated locally but client %s could not be updated remotely: %s",
                sa.id, sa.clientId, e.getMessage());
            return Result.failure(RemoteFailures.of("IDP_UPDATE_FAILED", sa.clientId, e, true));
        }
    }

    private static void applyChanges(ServiceAccount sa, UpdateServiceAccountCommand command, AccountType accountType) {
        sa.accountType = accountType;
        if (command.clientSecret() != null) {
            sa.clientSecret = command.clientSecret();
        }
        if (command.clientName() != null) {
            sa.clientName = command.clientName();
        }
        if (command.description() != null) {
            sa.description = command.description();
        }
        if (command.grantTypes() != null) {
            sa.grantTypes = new ArrayList<>(command.grantTypes());
        }
        if (command.responseTypes() != null) {
            sa.responseTypes = new ArrayList<>(command.responseTypes());
        }
        if (command.tokenEndpointAuthMethod() != null) {
            sa.tokenEndpointAuthMethod = command.tokenEndpointAuthMethod();
        }
        if (command.tokenEndpointAuthSigningAlg() != null) {
            sa.tokenEndpointAuthSigningAlg = command.tokenEndpointAuthSigningAlg();
        }
        if (command.audience() != null) {
            sa.audience = new ArrayList<>(command.audience());
        }
        if (command.redirectUris() != null) {
            sa.redirectUris = new ArrayList<>(command.redirectUris());
        }
        if (command.postLogoutRedirectUris() != null) {
            sa.postLogoutRedirectUris = new ArrayList<>(command.postLogoutRedirectUris());
        }
        if (command.allowedCorsOrigins() != null) {
            sa.allowedCorsOrigins = new ArrayList<>(command.allowedCorsOrigins());
        }
        if (command.skipConsent() != null) {
            sa.skipConsent = command.skipConsent();
        }
        if (command.owner() != null) {
            sa.owner = command.owner();
        }
        if (command.clientMetadata() != null) {
            sa.clientMetadata = new LinkedHashMap<>(command.clientMetadata());
        }
        if (command.jwks() != null) {
            sa.jwks = command.jwks();
        }
        if (command.jwksUri() != null) {
            sa.jwksUri = command.jwksUri();
        }
        if (command.idTokenSignedResponseAlg() != null) {
            sa.idTokenSignedResponseAlg = command.idTokenSignedResponseAlg();
        }
        if (command.active() != null) {
            sa.active = command.active();
        }
    }
}
