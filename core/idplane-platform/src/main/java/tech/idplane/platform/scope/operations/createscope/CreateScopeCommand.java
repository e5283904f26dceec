package tech.idplane.platform.scope.operations.createscope;

import tech.idplane.serviceaccount.entity.AccountType;

import java.util.List;

/**
 * Command to create a new Scope.
 *
 * @param name      unique scope string (e.g. "orders.read")
 * @param appliesTo account types allowed to hold the scope; null or empty means service-to-service only
 * @param active    null means active
 */
public record CreateScopeCommand(
    String name,
    String description,
    List<AccountType> appliesTo,
    Boolean active
) {}
