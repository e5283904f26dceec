package tech.idplane.platform.scope;

import tech.idplane.serviceaccount.entity.AccountType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Named OAuth2 scope, tagged with the account types allowed to hold it.
 */
public class Scope {

    public String id;

    /**
     * Unique scope string as it appears in tokens (e.g. "orders.read").
     */
    public String name;

    public String description;

    /**
     * Account types that may hold this scope. At most one entry per type.
     */
    public List<AccountType> appliesTo = new ArrayList<>(List.of(AccountType.SERVICE_TO_SERVICE));

    public boolean active = true;

    public Instant createdAt;

    public Instant updatedAt;

    public Scope() {
    }

    public boolean isApplicableTo(AccountType accountType) {
        return appliesTo != null && appliesTo.contains(accountType);
    }
}
