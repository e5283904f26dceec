package tech.idplane.platform.authorization;

import java.time.Instant;

/**
 * Named role that can be granted to service accounts.
 */
public class Role {

    public String id;

    /**
     * Unique role name (e.g. "billing:reader").
     */
    public String name;

    public String description;

    public Instant createdAt;

    public Instant updatedAt;

    public Role() {
    }

    public Role(String id, String name, String description) {
        this.id = id;
        this.name = name;
        this.description = description;
    }
}
