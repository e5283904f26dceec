package tech.idplane.user.repository;

import tech.idplane.user.entity.User;

import java.util.List;
import java.util.Optional;

/**
 * Repository for User aggregates. Reads return the user with its roles loaded.
 */
public interface UserRepository {

    Optional<User> findById(String id);

    /**
     * Case-insensitive email lookup.
     */
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * Users ordered by email.
     */
    List<User> list(int skip, int limit);

    long count();

    List<User> findByRoleId(String roleId);

    void persist(User user);

    void update(User user);

    /**
     * Bring the role set to exactly {@code roleIds}.
     */
    void replaceRoles(String userId, List<String> roleIds);

    /**
     * @return false when the role was already held
     */
    boolean assignRole(String userId, String roleId);

    /**
     * @return false when the role was not held
     */
    boolean removeRole(String userId, String roleId);

    boolean deleteWithRoles(String id);
}
