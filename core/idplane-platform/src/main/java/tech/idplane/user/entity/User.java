package tech.idplane.user.entity;

import tech.idplane.platform.authorization.Role;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A human administrator or end user who signs in through the login hand-off.
 *
 * <p>Users are local only; nothing about them is pushed to the authorization server.
 * The server only learns the user id as the login subject.
 */
public class User {

    public String id;

    /**
     * Unique sign-in email.
     */
    public String email;

    /**
     * Argon2id hash in PHC format. Never exposed over the API.
     */
    public String passwordHash;

    public String displayName;

    public boolean active = true;

    public Instant lastLoginAt;

    /**
     * Wrong passwords since the last successful sign-in.
     */
    public int failedLoginAttempts;

    /**
     * Sign-in is refused until this instant. Null means not locked.
     */
    public Instant lockedUntil;

    public Instant createdAt;

    public Instant updatedAt;

    public List<Role> roles = new ArrayList<>();

    public User() {
    }

    public boolean isLocked(Instant now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public boolean canLogin(Instant now) {
        return active && !isLocked(now);
    }

    public List<String> roleIds() {
        return roles.stream().map(r -> r.id).toList();
    }

    public List<String> roleNames() {
        return roles.stream().map(r -> r.name).toList();
    }
}
