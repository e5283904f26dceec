package tech.idplane.platform.scope.operations.setscopesactive;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.events.ScopesActivationChanged;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Bulk activate or deactivate scopes. Ids that match no scope are skipped; the
 * event lists the ones that were changed.
 */
@ApplicationScoped
public class SetScopesActiveUseCase {

    @Inject
    ScopeRepository scopeRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopesActivationChanged> execute(SetScopesActiveCommand command, ExecutionContext context) {
        if (command.scopeIds() == null || command.scopeIds().isEmpty()) {
            return Result.failure(new UseCaseError.ValidationError(
                "SCOPE_IDS_REQUIRED",
                "At least one scope id is required",
                Map.of()
            ));
        }

        List<String> found = scopeRepo.findByIds(List.copyOf(new LinkedHashSet<>(command.scopeIds()))).stream()
            .map(s -> s.id)
            .toList();

        ScopesActivationChanged event = ScopesActivationChanged.fromContext(context)
            .scopeIds(found)
            .active(command.active())
            .build();

        return unitOfWork.commit(() -> scopeRepo.setActive(found, command.active()), event, command);
    }
}
