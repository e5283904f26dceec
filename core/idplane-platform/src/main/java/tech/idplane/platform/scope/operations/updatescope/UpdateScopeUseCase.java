package tech.idplane.platform.scope.operations.updatescope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.events.ScopeUpdated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Use case for updating a Scope.
 *
 * <p>None of the editable fields appear in a client's scope string, so holders need
 * no remote update. An empty {@code appliesTo} is rejected; a scope must apply to
 * at least one account type.
 */
@ApplicationScoped
public class UpdateScopeUseCase {

    @Inject
    ScopeRepository scopeRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopeUpdated> execute(UpdateScopeCommand command, ExecutionContext context) {
        Scope scope = scopeRepo.findById(command.scopeId()).orElse(null);
        if (scope == null) {
            return Result.failure(new UseCaseError.NotFoundError(
                "SCOPE_NOT_FOUND",
                "Scope not found",
                Map.of("scopeId", String.valueOf(command.scopeId()))
            ));
        }
        if (command.appliesTo() != null && command.appliesTo().isEmpty()) {
            return Result.failure(new UseCaseError.ValidationError(
                "APPLIES_TO_REQUIRED",
                "A scope must apply to at least one account type",
                Map.of()
            ));
        }

        if (command.description() != null) {
            scope.description = command.description();
        }
        if (command.appliesTo() != null) {
            scope.appliesTo = new ArrayList<>(new LinkedHashSet<>(command.appliesTo()));
        }
        if (command.active() != null) {
            scope.active = command.active();
        }

        ScopeUpdated event = ScopeUpdated.fromContext(context)
            .scopeId(scope.id)
            .scopeName(scope.name)
            .build();

        return unitOfWork.commit(() -> scopeRepo.update(scope), event, command);
    }
}
