package tech.idplane.platform.authorization.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for roles table.
 */
@Entity
@Table(name = "roles")
public class RoleEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    public String name;

    @Column(name = "description", length = 500)
    public String description;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public RoleEntity() {
    }
}
