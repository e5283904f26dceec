package tech.idplane.platform.scope.operations.deletescope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.events.ScopeDeleted;

import java.util.Map;

/**
 * Use case for deleting a Scope.
 *
 * <p>Only the local associations are removed. Registered clients keep the scope in
 * their scope string until they are resynced or the next bulk sync runs.
 */
@ApplicationScoped
public class DeleteScopeUseCase {

    private static final Logger LOG = Logger.getLogger(DeleteScopeUseCase.class);

    @Inject
    ScopeRepository scopeRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopeDeleted> execute(DeleteScopeCommand command, ExecutionContext context) {
        Scope scope = scopeRepo.findById(command.scopeId()).orElse(null);
        if (scope == null) {
            return Result.failure(new UseCaseError.NotFoundError(
                "SCOPE_NOT_FOUND",
                "Scope not found",
                Map.of("scopeId", String.valueOf(command.scopeId()))
            ));
        }

        ScopeDeleted event = ScopeDeleted.fromContext(context)
            .scopeId(scope.id)
            .scopeName(scope.name)
            .build();

        Result<ScopeDeleted> result =
            unitOfWork.commit(() -> scopeRepo.deleteWithAssignments(scope.id), event, command);
        if (result.isSuccess()) {
            LOG.infof("Scope %s deleted; remote clients are corrected on the next sync", scope.name);
        }
        return result;
    }
}
