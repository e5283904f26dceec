package tech.idplane.platform.authorization.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.authorization.entity.RoleEntity;
import tech.idplane.platform.authorization.mapper.RoleMapper;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Role entities.
 * Uses EntityManager directly to return domain objects; writes go to {@link RoleWriteRepository}.
 */
@ApplicationScoped
public class RoleReadRepository implements RoleRepository {

    @Inject
    EntityManager em;

    @Inject
    RoleWriteRepository writeRepo;

    @Override
    public Optional<Role> findById(String id) {
        return Optional.ofNullable(toDomain(em.find(RoleEntity.class, id)));
    }

    @Override
    public Optional<Role> findByName(String name) {
        return em.createQuery("FROM RoleEntity WHERE name = :name", RoleEntity.class)
            .setParameter("name", name)
            .getResultStream()
            .findFirst()
            .map(this::toDomain);
    }

    @Override
    public List<Role> findByIds(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return em.createQuery("FROM RoleEntity WHERE id IN :ids ORDER BY name", RoleEntity.class)
            .setParameter("ids", ids)
            .getResultList()
            .stream()
            .map(this::toDomain)
            .toList();
    }

    @Override
    public List<Role> listAll() {
        return em.createQuery("FROM RoleEntity ORDER BY name", RoleEntity.class)
            .getResultList()
            .stream()
            .map(this::toDomain)
            .toList();
    }

    @Override
    public void persist(Role role) {
        writeRepo.persistRole(role);
    }

    @Override
    public void update(Role role) {
        writeRepo.updateRole(role);
    }

    @Override
    public boolean deleteWithAssignments(String id) {
        return writeRepo.deleteRole(id);
    }

    /**
     * Map, then detach when read outside a transaction so a later read in the same
     * request sees committed updates.
     */
    private Role toDomain(RoleEntity entity) {
        if (entity == null) {
            return null;
        }
        Role role = RoleMapper.toDomain(entity);
        if (!em.isJoinedToTransaction()) {
            em.detach(entity);
        }
        return role;
    }
}
