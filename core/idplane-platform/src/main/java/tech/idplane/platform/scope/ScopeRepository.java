package tech.idplane.platform.scope;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Scope entities.
 */
public interface ScopeRepository {

    Optional<Scope> findById(String id);

    Optional<Scope> findByName(String name);

    List<Scope> findByIds(List<String> ids);

    List<Scope> listAll(boolean activeOnly);

    void persist(Scope scope);

    void update(Scope scope);

    /**
     * Set the active flag on every listed scope that exists.
     */
    void setActive(List<String> ids, boolean active);

    /**
     * Delete a scope after removing it from every service account.
     *
     * @return false when the scope did not exist
     */
    boolean deleteWithAssignments(String id);

    /**
     * Bulk form of {@link #deleteWithAssignments(String)}. Unknown ids are ignored.
     */
    void deleteAllWithAssignments(List<String> ids);
}
