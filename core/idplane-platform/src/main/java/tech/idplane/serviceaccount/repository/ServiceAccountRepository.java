package tech.idplane.serviceaccount.repository;

import tech.idplane.serviceaccount.entity.ServiceAccount;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ServiceAccount entities and their role and scope associations.
 *
 * <p>Lookups return accounts with roles and scopes loaded. Absence is reported as
 * an empty Optional or a false return, never as an exception.
 */
public interface ServiceAccountRepository {

    Optional<ServiceAccount> findById(String id);

    Optional<ServiceAccount> findByClientId(String clientId);

    boolean existsByClientId(String clientId);

    List<ServiceAccount> findWithFilter(ServiceAccountFilter filter);

    long countWithFilter(ServiceAccountFilter filter);

    /**
     * One page of accounts ordered by client id, starting after {@code afterClientId}
     * ({@code null} for the first page). Keyed on client id so rows removed between
     * pages never shift later rows out of the listing.
     */
    List<ServiceAccount> listPage(String afterClientId, int limit);

    /**
     * Accounts holding the role, ordered by client id.
     */
    List<ServiceAccount> findByRoleId(String roleId);

    /**
     * Accounts holding the scope, ordered by client id.
     */
    List<ServiceAccount> findByScopeId(String scopeId);

    /**
     * Insert the account together with the roles and scopes it carries.
     * Fills in id and timestamps when absent.
     */
    void persist(ServiceAccount serviceAccount);

    /**
     * Write every mutable field and refresh {@code updatedAt}. Associations are untouched.
     */
    void update(ServiceAccount serviceAccount);

    /**
     * Replace the whole role set of the account.
     */
    void replaceRoles(String serviceAccountId, List<String> roleIds);

    /**
     * Replace the whole scope set of the account.
     */
    void replaceScopes(String serviceAccountId, List<String> scopeIds);

    /**
     * @return true if the association was added, false if it already existed
     */
    boolean assignRole(String serviceAccountId, String roleId);

    /**
     * @return true if the association was removed, false if it did not exist
     */
    boolean removeRole(String serviceAccountId, String roleId);

    boolean assignScope(String serviceAccountId, String scopeId);

    boolean removeScope(String serviceAccountId, String scopeId);

    /**
     * Clear every role and scope association, then delete the row, in one transaction.
     *
     * @return false when the account did not exist
     */
    boolean deleteWithAssociations(String id);
}
