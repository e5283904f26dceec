package tech.idplane.platform.scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.scope.events.ScopeCreated;
import tech.idplane.platform.scope.events.ScopeDeleted;
import tech.idplane.platform.scope.events.ScopeUpdated;
import tech.idplane.platform.scope.events.ScopesActivationChanged;
import tech.idplane.platform.scope.events.ScopesDeleted;
import tech.idplane.platform.scope.operations.createscope.CreateScopeCommand;
import tech.idplane.platform.scope.operations.createscope.CreateScopeUseCase;
import tech.idplane.platform.scope.operations.deletescope.DeleteScopeCommand;
import tech.idplane.platform.scope.operations.deletescope.DeleteScopeUseCase;
import tech.idplane.platform.scope.operations.deletescopes.DeleteScopesCommand;
import tech.idplane.platform.scope.operations.deletescopes.DeleteScopesUseCase;
import tech.idplane.platform.scope.operations.setscopesactive.SetScopesActiveCommand;
import tech.idplane.platform.scope.operations.setscopesactive.SetScopesActiveUseCase;
import tech.idplane.platform.scope.operations.updatescope.UpdateScopeCommand;
import tech.idplane.platform.scope.operations.updatescope.UpdateScopeUseCase;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.List;
import java.util.Optional;

/**
 * Single point of discovery for the Scope aggregate.
 */
@ApplicationScoped
public class ScopeOperations {

    @Inject
    CreateScopeUseCase createScopeUseCase;

    @Inject
    UpdateScopeUseCase updateScopeUseCase;

    @Inject
    DeleteScopeUseCase deleteScopeUseCase;

    @Inject
    SetScopesActiveUseCase setScopesActiveUseCase;

    @Inject
    DeleteScopesUseCase deleteScopesUseCase;

    @Inject
    ScopeRepository repo;

    public Result<ScopeCreated> createScope(CreateScopeCommand command, ExecutionContext context) {
        return createScopeUseCase.execute(command, context);
    }

    public Result<ScopeUpdated> updateScope(UpdateScopeCommand command, ExecutionContext context) {
        return updateScopeUseCase.execute(command, context);
    }

    public Result<ScopeDeleted> deleteScope(DeleteScopeCommand command, ExecutionContext context) {
        return deleteScopeUseCase.execute(command, context);
    }

    public Result<ScopesActivationChanged> activateScopes(List<String> scopeIds, ExecutionContext context) {
        return setScopesActiveUseCase.execute(new SetScopesActiveCommand(scopeIds, true), context);
    }

    public Result<ScopesActivationChanged> deactivateScopes(List<String> scopeIds, ExecutionContext context) {
        return setScopesActiveUseCase.execute(new SetScopesActiveCommand(scopeIds, false), context);
    }

    public Result<ScopesDeleted> deleteScopes(DeleteScopesCommand command, ExecutionContext context) {
        return deleteScopesUseCase.execute(command, context);
    }

    public Optional<Scope> findById(String id) {
        return repo.findById(id);
    }

    public List<Scope> findAll(boolean activeOnly) {
        return repo.listAll(activeOnly);
    }

    /**
     * Active scopes an account of the given type may hold.
     */
    public List<Scope> findForAccountType(AccountType accountType) {
        return repo.listAll(true).stream()
            .filter(scope -> scope.isApplicableTo(accountType))
            .toList();
    }
}
