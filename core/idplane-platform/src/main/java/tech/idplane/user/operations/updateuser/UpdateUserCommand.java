package tech.idplane.user.operations.updateuser;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Partial update of a user. Null fields are left alone; {@code roleIds} replaces the whole set.
 */
@Builder
public record UpdateUserCommand(
    String userId,
    String email,
    String displayName,
    @JsonIgnore String password,
    Boolean active,
    Instant lockedUntil,
    List<String> roleIds
) {}
