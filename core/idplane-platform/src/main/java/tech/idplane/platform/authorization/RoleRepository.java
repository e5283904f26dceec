package tech.idplane.platform.authorization;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Role entities.
 */
public interface RoleRepository {

    Optional<Role> findById(String id);

    Optional<Role> findByName(String name);

    List<Role> findByIds(List<String> ids);

    List<Role> listAll();

    void persist(Role role);

    void update(Role role);

    /**
     * Delete a role after removing it from every service account and user.
     *
     * @return false when the role did not exist
     */
    boolean deleteWithAssignments(String id);
}
