package tech.idplane.serviceaccount.jpaentity;

import jakarta.persistence.*;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA Entity for service_account_roles join table.
 * The primary key is the pair of foreign keys.
 */
@Entity
@Table(name = "service_account_roles")
@IdClass(ServiceAccountRoleEntity.Key.class)
public class ServiceAccountRoleEntity {

    @Id
    @Column(name = "service_account_id", nullable = false, length = 17)
    public String serviceAccountId;

    @Id
    @Column(name = "role_id", nullable = false, length = 17)
    public String roleId;

    public ServiceAccountRoleEntity() {
    }

    public ServiceAccountRoleEntity(String serviceAccountId, String roleId) {
        this.serviceAccountId = serviceAccountId;
        this.roleId = roleId;
    }

    public static class Key implements Serializable {
        public String serviceAccountId;
        public String roleId;

        public Key() {
        }

        public Key(String serviceAccountId, String roleId) {
            this.serviceAccountId = serviceAccountId;
            this.roleId = roleId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(serviceAccountId, other.serviceAccountId)
                && Objects.equals(roleId, other.roleId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(serviceAccountId, roleId);
        }
    }
}
