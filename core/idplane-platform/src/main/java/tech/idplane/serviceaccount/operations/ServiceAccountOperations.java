package tech.idplane.serviceaccount.operations;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.operations.assignrole.AssignRoleCommand;
import tech.idplane.serviceaccount.operations.assignrole.AssignRoleUseCase;
import tech.idplane.serviceaccount.operations.assignrole.RoleAssigned;
import tech.idplane.serviceaccount.operations.assignscope.AssignScopeCommand;
import tech.idplane.serviceaccount.operations.assignscope.AssignScopeUseCase;
import tech.idplane.serviceaccount.operations.assignscope.ScopeAssigned;
import tech.idplane.serviceaccount.operations.createserviceaccount.CreateServiceAccountCommand;
import tech.idplane.serviceaccount.operations.createserviceaccount.CreateServiceAccountUseCase;
import tech.idplane.serviceaccount.operations.createserviceaccount.ServiceAccountCreated;
import tech.idplane.serviceaccount.operations.deleteserviceaccount.DeleteServiceAccountCommand;
import tech.idplane.serviceaccount.operations.deleteserviceaccount.DeleteServiceAccountUseCase;
import tech.idplane.serviceaccount.operations.deleteserviceaccount.ServiceAccountDeleted;
import tech.idplane.serviceaccount.operations.removerole.RemoveRoleCommand;
import tech.idplane.serviceaccount.operations.removerole.RemoveRoleUseCase;
import tech.idplane.serviceaccount.operations.removerole.RoleRemoved;
import tech.idplane.serviceaccount.operations.removescope.RemoveScopeCommand;
import tech.idplane.serviceaccount.operations.removescope.RemoveScopeUseCase;
import tech.idplane.serviceaccount.operations.removescope.ScopeRemoved;
import tech.idplane.serviceaccount.operations.resyncserviceaccount.ResyncServiceAccountCommand;
import tech.idplane.serviceaccount.operations.resyncserviceaccount.ResyncServiceAccountUseCase;
import tech.idplane.serviceaccount.operations.resyncserviceaccount.ServiceAccountResynced;
import tech.idplane.serviceaccount.operations.updateserviceaccount.ServiceAccountUpdated;
import tech.idplane.serviceaccount.operations.updateserviceaccount.UpdateServiceAccountCommand;
import tech.idplane.serviceaccount.operations.updateserviceaccount.UpdateServiceAccountUseCase;
import tech.idplane.serviceaccount.repository.ServiceAccountFilter;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.List;
import java.util.Optional;

/**
 * Facade for all service account operations.
 * Provides a single entry point for mutations (which require ExecutionContext)
 * and queries (which don't require context).
 */
@ApplicationScoped
public class ServiceAccountOperations {

    @Inject
    CreateServiceAccountUseCase createUseCase;

    @Inject
    UpdateServiceAccountUseCase updateUseCase;

    @Inject
    DeleteServiceAccountUseCase deleteUseCase;

    @Inject
    AssignRoleUseCase assignRoleUseCase;

    @Inject
    RemoveRoleUseCase removeRoleUseCase;

    @Inject
    AssignScopeUseCase assignScopeUseCase;

    @Inject
    RemoveScopeUseCase removeScopeUseCase;

    @Inject
    ResyncServiceAccountUseCase resyncUseCase;

    @Inject
    ServiceAccountRepository repository;

    // ==================== MUTATIONS (require ExecutionContext) ====================

    /**
     * Create a service account and register its client.
     */
    public Result<ServiceAccountCreated> create(CreateServiceAccountCommand command, ExecutionContext context) {
        return createUseCase.execute(command, context);
    }

    public Result<ServiceAccountUpdated> update(UpdateServiceAccountCommand command, ExecutionContext context) {
        return updateUseCase.execute(command, context);
    }

    public Result<ServiceAccountUpdated> activate(String serviceAccountId, ExecutionContext context) {
        return updateUseCase.execute(UpdateServiceAccountCommand.activation(serviceAccountId, true), context);
    }

    public Result<ServiceAccountUpdated> deactivate(String serviceAccountId, ExecutionContext context) {
        return updateUseCase.execute(UpdateServiceAccountCommand.activation(serviceAccountId, false), context);
    }

    /**
     * Delete a service account. The remote delete is attempted first when requested
     * but never prevents the local delete.
     */
    public Result<ServiceAccountDeleted> delete(String serviceAccountId, boolean syncToIdp, ExecutionContext context) {
        return deleteUseCase.execute(new DeleteServiceAccountCommand(serviceAccountId, syncToIdp), context);
    }

    public Result<RoleAssigned> assignRole(String serviceAccountId, String roleId, ExecutionContext context) {
        return assignRoleUseCase.execute(new AssignRoleCommand(serviceAccountId, roleId), context);
    }

    public Result<RoleRemoved> removeRole(String serviceAccountId, String roleId, ExecutionContext context) {
        return removeRoleUseCase.execute(new RemoveRoleCommand(serviceAccountId, roleId), context);
    }

    public Result<ScopeAssigned> assignScope(String serviceAccountId, String scopeId, ExecutionContext context) {
        return assignScopeUseCase.execute(new AssignScopeCommand(serviceAccountId, scopeId, true), context);
    }

    public Result<ScopeRemoved> removeScope(String serviceAccountId, String scopeId, ExecutionContext context) {
        return removeScopeUseCase.execute(new RemoveScopeCommand(serviceAccountId, scopeId, true), context);
    }

    /**
     * Push one service account to the authorization server, creating the client if it is missing.
     */
    public Result<ServiceAccountResynced> resync(String serviceAccountId, ExecutionContext context) {
        return resyncUseCase.execute(new ResyncServiceAccountCommand(serviceAccountId), context);
    }

    // ==================== QUERIES (no context needed) ====================

    public Optional<ServiceAccount> findById(String id) {
        return repository.findById(id);
    }

    public Optional<ServiceAccount> findByClientId(String clientId) {
        return repository.findByClientId(clientId);
    }

    public List<ServiceAccount> findWithFilter(ServiceAccountFilter filter) {
        return repository.findWithFilter(filter);
    }

    public long countWithFilter(ServiceAccountFilter filter) {
        return repository.countWithFilter(filter);
    }

    public List<ServiceAccount> findByRole(String roleId) {
        return repository.findByRoleId(roleId);
    }

    public List<ServiceAccount> findByScope(String scopeId) {
        return repository.findByScopeId(scopeId);
    }
}
