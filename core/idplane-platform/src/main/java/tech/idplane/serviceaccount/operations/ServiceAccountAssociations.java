package tech.idplane.serviceaccount.operations;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves role and scope id lists supplied by callers, rejecting unknown ids and
 * scopes that do not apply to the account type.
 */
@ApplicationScoped
public class ServiceAccountAssociations {

    @Inject
    RoleRepository roleRepository;

    @Inject
    ScopeRepository scopeRepository;

    public Result<List<Role>> resolveRoles(List<String> roleIds) {
        if (roleIds == null || roleIds.isEmpty()) {
            return Result.success(List.of());
        }
        Set<String> wanted = new LinkedHashSet<>(roleIds);
        List<Role> roles = roleRepository.findByIds(List.copyOf(wanted));
        if (roles.size() != wanted.size()) {
            Set<String> found = roles.stream().map(r -> r.id).collect(Collectors.toSet());
            List<String> missing = wanted.stream().filter(id -> !found.contains(id)).toList();
            return Result.failure(new UseCaseError.NotFoundError(
                "ROLE_NOT_FOUND",
                "Role not found: " + String.join(", ", missing),
                Map.of("roleIds", missing)
            ));
        }
        return Result.success(roles);
    }

    public Result<List<Scope>> resolveScopes(List<String> scopeIds, AccountType accountType) {
        if (scopeIds == null || scopeIds.isEmpty()) {
            return Result.success(List.of());
        }
        Set<String> wanted = new LinkedHashSet<>(scopeIds);
        List<Scope> scopes = scopeRepository.findByIds(List.copyOf(wanted));
        if (scopes.size() != wanted.size()) {
            Set<String> found = scopes.stream().map(s -> s.id).collect(Collectors.toSet());
            List<String> missing = wanted.stream().filter(id -> !found.contains(id)).toList();
            return Result.failure(new UseCaseError.NotFoundError(
                "SCOPE_NOT_FOUND",
                "Scope not found: " + String.join(", ", missing),
                Map.of("scopeIds", missing)
            ));
        }
        for (Scope scope : scopes) {
            if (!scope.isApplicableTo(accountType)) {
                return Result.failure(notApplicable(scope, accountType));
            }
        }
        return Result.success(scopes);
    }

    public static UseCaseError notApplicable(Scope scope, AccountType accountType) {
        return new UseCaseError.ValidationError(
            "SCOPE_NOT_APPLICABLE",
            "Scope '" + scope.name + "' cannot be held by " + accountType.value() + " accounts",
            Map.of("scope", scope.name, "accountType", accountType.value())
        );
    }
}
