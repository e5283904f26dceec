package tech.idplane.platform.scope.operations.updatescope;

import tech.idplane.serviceaccount.entity.AccountType;

import java.util.List;

/**
 * Partial scope update. The name cannot change: it is the token string already
 * registered on clients. Null fields are left alone.
 */
public record UpdateScopeCommand(
    String scopeId,
    String description,
    List<AccountType> appliesTo,
    Boolean active
) {}
