package tech.idplane.platform.scope.mapper;

import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.entity.ScopeEntity;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapper between Scope domain objects and ScopeEntity.
 */
public final class ScopeMapper {

    static final String DELIMITER = ",";

    private ScopeMapper() {
    }

    public static Scope toDomain(ScopeEntity entity) {
        if (entity == null) {
            return null;
        }
        Scope scope = new Scope();
        scope.id = entity.id;
        scope.name = entity.name;
        scope.description = entity.description;
        scope.appliesTo = parseAppliesTo(entity.appliesTo);
        scope.active = entity.active;
        scope.createdAt = entity.createdAt;
        scope.updatedAt = entity.updatedAt;
        return scope;
    }

    public static ScopeEntity toEntity(Scope domain) {
        if (domain == null) {
            return null;
        }
        ScopeEntity entity = new ScopeEntity();
        entity.id = domain.id;
        entity.name = domain.name;
        entity.description = domain.description;
        entity.appliesTo = formatAppliesTo(domain.appliesTo);
        entity.active = domain.active;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }

    public static List<AccountType> parseAppliesTo(String stored) {
        if (stored == null || stored.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(stored.split(DELIMITER))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(AccountType::fromValue)
            .distinct()
            .collect(Collectors.toCollection(ArrayList::new));
    }

    public static String formatAppliesTo(List<AccountType> appliesTo) {
        if (appliesTo == null) {
            return "";
        }
        return appliesTo.stream()
            .distinct()
            .map(AccountType::value)
            .collect(Collectors.joining(DELIMITER));
    }
}
