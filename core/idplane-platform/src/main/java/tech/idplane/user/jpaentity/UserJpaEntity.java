package tech.idplane.user.jpaentity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for users table.
 */
@Entity
@Table(name = "users")
public class UserJpaEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    public String email;

    @Column(name = "password_hash", length = 255)
    public String passwordHash;

    @Column(name = "display_name", length = 255)
    public String displayName;

    @Column(name = "active", nullable = false)
    public boolean active = true;

    @Column(name = "last_login_at")
    public Instant lastLoginAt;

    @Column(name = "failed_login_attempts", nullable = false)
    public int failedLoginAttempts;

    @Column(name = "locked_until")
    public Instant lockedUntil;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public UserJpaEntity() {
    }
}
