package tech.idplane.platform.scope.operations.deletescopes;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.events.ScopesDeleted;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Bulk scope delete. Like a single delete it only touches local rows; registered
 * clients are corrected by a resync or the next bulk sync.
 */
@ApplicationScoped
public class DeleteScopesUseCase {

    private static final Logger LOG = Logger.getLogger(DeleteScopesUseCase.class);

    @Inject
    ScopeRepository scopeRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopesDeleted> execute(DeleteScopesCommand command, ExecutionContext context) {
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

        ScopesDeleted event = ScopesDeleted.fromContext(context)
            .scopeIds(found)
            .build();

        Result<ScopesDeleted> result =
            unitOfWork.commit(() -> scopeRepo.deleteAllWithAssignments(found), event, command);
        if (result.isSuccess()) {
            LOG.infof("%d scope(s) deleted; remote clients are corrected on the next sync", found.size());
        }
        return result;
    }
}
