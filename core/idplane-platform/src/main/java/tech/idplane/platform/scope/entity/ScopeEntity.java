package tech.idplane.platform.scope.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for scopes table.
 * {@code applies_to} holds account type values separated by commas.
 */
@Entity
@Table(name = "scopes")
public class ScopeEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, unique = true, length = 255)
    public String name;

    @Column(name = "description", length = 500)
    public String description;

    @Column(name = "applies_to", nullable = false, length = 100)
    public String appliesTo;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public ScopeEntity() {
    }
}
