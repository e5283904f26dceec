package tech.idplane.user.jpaentity;

import jakarta.persistence.*;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA Entity for user_roles join table, keyed by both foreign keys.
 */
@Entity
@Table(name = "user_roles")
@IdClass(UserRoleEntity.Key.class)
public class UserRoleEntity {

    @Id
    @Column(name = "user_id", nullable = false, length = 17)
    public String userId;

    @Id
    @Column(name = "role_id", nullable = false, length = 17)
    public String roleId;

    public UserRoleEntity() {
    }

    public UserRoleEntity(String userId, String roleId) {
        this.userId = userId;
        this.roleId = roleId;
    }

    public static class Key implements Serializable {
        public String userId;
        public String roleId;

        public Key() {
        }

        public Key(String userId, String roleId) {
            this.userId = userId;
            this.roleId = roleId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(userId, other.userId) && Objects.equals(roleId, other.roleId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(userId, roleId);
        }
    }
}
