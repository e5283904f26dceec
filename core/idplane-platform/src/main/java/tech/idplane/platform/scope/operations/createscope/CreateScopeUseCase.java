package tech.idplane.platform.scope.operations.createscope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.events.ScopeCreated;
import tech.idplane.platform.shared.EntityType;
import tech.idplane.platform.shared.TsidGenerator;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Use case for creating a Scope.
 */
@ApplicationScoped
public class CreateScopeUseCase {

    @Inject
    ScopeRepository scopeRepo;

    @Inject
    UnitOfWork unitOfWork;

    public Result<ScopeCreated> execute(CreateScopeCommand command, ExecutionContext context) {
        String name = command.name();
        if (name == null || name.isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                "NAME_REQUIRED",
                "Scope name is required",
                Map.of()
            ));
        }
        // Scope strings are space-delimited in OAuth2, so a name cannot contain whitespace
        if (name.length() > 255 || name.chars().anyMatch(Character::isWhitespace)) {
            return Result.failure(new UseCaseError.ValidationError(
                "INVALID_SCOPE_NAME",
                "Scope name must be at most 255 characters and contain no whitespace",
                Map.of("name", name)
            ));
        }

        if (scopeRepo.findByName(name).isPresent()) {
            return Result.failure(new UseCaseError.ConflictError(
                "SCOPE_EXISTS",
                "Scope with name '" + name + "' already exists",
                Map.of("scopeName", name)
            ));
        }

        Scope scope = new Scope();
        scope.id = TsidGenerator.generate(EntityType.SCOPE);
        scope.name = name;
        scope.description = command.description();
        if (command.appliesTo() != null && !command.appliesTo().isEmpty()) {
            List<AccountType> appliesTo = new ArrayList<>(new LinkedHashSet<>(command.appliesTo()));
            scope.appliesTo = appliesTo;
        }
        scope.active = command.active() == null || command.active();

        ScopeCreated event = ScopeCreated.fromContext(context)
            .scopeId(scope.id)
            .scopeName(scope.name)
            .build();

        return unitOfWork.commit(() -> scopeRepo.persist(scope), event, command);
    }
}
