package tech.idplane.serviceaccount.jpaentity;

import jakarta.persistence.*;

import java.io.Serializable;
import java.util.Objects;

/**
 * JPA Entity for service_account_scopes join table.
 * The primary key is the pair of foreign keys.
 */
@Entity
@Table(name = "service_account_scopes")
@IdClass(ServiceAccountScopeEntity.Key.class)
public class ServiceAccountScopeEntity {

    @Id
    @Column(name = "service_account_id", nullable = false, length = 17)
    public String serviceAccountId;

    @Id
    @Column(name = "scope_id", nullable = false, length = 17)
    public String scopeId;

    public ServiceAccountScopeEntity() {
    }

    public ServiceAccountScopeEntity(String serviceAccountId, String scopeId) {
        this.serviceAccountId = serviceAccountId;
        this.scopeId = scopeId;
    }

    public static class Key implements Serializable {
        public String serviceAccountId;
        public String scopeId;

        public Key() {
        }

        public Key(String serviceAccountId, String scopeId) {
            this.serviceAccountId = serviceAccountId;
            this.scopeId = scopeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(serviceAccountId, other.serviceAccountId)
                && Objects.equals(scopeId, other.scopeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(serviceAccountId, scopeId);
        }
    }
}
