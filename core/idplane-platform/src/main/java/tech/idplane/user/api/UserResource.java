package tech.idplane.user.api;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idplane.platform.audit.AuditContext;
import tech.idplane.platform.audit.AuditLogRepository;
import tech.idplane.platform.audit.api.AuditLogResource;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.api.ApiErrors;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserOperations;
import tech.idplane.user.operations.createuser.CreateUserCommand;
import tech.idplane.user.operations.createuser.UserCreated;
import tech.idplane.user.operations.updateuser.UpdateUserCommand;

import java.time.Instant;
import java.util.List;

/**
 * User administration. Users are local only; the authorization server sees a user
 * id as the login subject and nothing else. Password hashes are never returned.
 */
@Path("/users")
@Tag(name = "Users", description = "Human user administration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserResource {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;
    static final int AUDIT_LIMIT = 100;

    @Inject
    UserOperations operations;

    @Inject
    AuditLogRepository auditLogRepository;

    @Inject
    AuditContext auditContext;

    // ==================== CRUD Operations ====================

    @GET
    @Operation(summary = "List users", description = "Ordered by email")
    public UserListResponse list(
            @QueryParam("skip") @DefaultValue("0") @Parameter(description = "Rows to skip") int skip,
            @QueryParam("limit") @DefaultValue("100") @Parameter(description = "Page size, at most 1000") int limit) {
        int safeSkip = Math.max(0, skip);
        int safeLimit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        List<UserDto> items = operations.list(safeSkip, safeLimit).stream().map(UserResource::toDto).toList();
        return new UserListResponse(items, operations.count(), safeSkip, safeLimit);
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get user by ID")
    public Response getById(@PathParam("id") String id) {
        return userOrNotFound(id);
    }

    @POST
    @Operation(summary = "Create a user")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "User created"),
        @APIResponse(responseCode = "404", description = "Referenced role not found"),
        @APIResponse(responseCode = "409", description = "Email already in use"),
        @APIResponse(responseCode = "422", description = "Invalid email or password")
    })
    public Response create(@Valid CreateUserRequest request, @Context UriInfo uriInfo) {
        Result<UserCreated> result = operations.create(
            new CreateUserCommand(request.email(), request.password(), request.displayName(),
                request.active(), request.roleIds()),
            auditContext.executionContext()
        );
        if (result instanceof Result.Success<UserCreated> s) {
            User user = operations.findById(s.value().userId()).orElseThrow();
            return Response.status(Response.Status.CREATED)
                .entity(toDto(user))
                .location(uriInfo.getBaseUriBuilder().path(UserResource.class).path(user.id).build())
                .build();
        }
        return ApiErrors.toResponse(((Result.Failure<UserCreated>) result).error());
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update a user",
        description = "Partial update. roleIds replaces the whole set; a password is hashed like on create.")
    public Response update(@PathParam("id") String id, @Valid UpdateUserRequest request) {
        UpdateUserCommand command = UpdateUserCommand.builder()
            .userId(id)
            .email(request.email())
            .displayName(request.displayName())
            .password(request.password())
            .active(request.active())
            .lockedUntil(request.lockedUntil())
            .roleIds(request.roleIds())
            .build();
        return userOrError(id, operations.update(command, auditContext.executionContext()));
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a user", description = "Role grants are removed with the user.")
    public Response delete(@PathParam("id") String id) {
        var result = operations.delete(id, auditContext.executionContext());
        if (result instanceof Result.Failure<?> f) {
            return ApiErrors.toResponse(f.error());
        }
        return Response.noContent().build();
    }

    // ==================== Credentials and Lock ====================

    @POST
    @Path("/{id}/reset-password")
    @Operation(summary = "Set a new password")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Password replaced"),
        @APIResponse(responseCode = "404", description = "User not found"),
        @APIResponse(responseCode = "422", description = "Password too short or too long")
    })
    public Response resetPassword(@PathParam("id") String id, @Valid ResetPasswordRequest request) {
        var result = operations.resetPassword(id, request.newPassword(), auditContext.executionContext());
        if (result instanceof Result.Failure<?> f) {
            return ApiErrors.toResponse(f.error());
        }
        return Response.noContent().build();
    }

    @POST
    @Path("/{id}/lock")
    @Operation(summary = "Lock a user for 24 hours")
    public Response lock(@PathParam("id") String id) {
        return userOrError(id, operations.lock(id, auditContext.executionContext()));
    }

    @POST
    @Path("/{id}/unlock")
    @Operation(summary = "Unlock a user", description = "Also clears the failed login counter.")
    public Response unlock(@PathParam("id") String id) {
        return userOrError(id, operations.unlock(id, auditContext.executionContext()));
    }

    // ==================== Roles ====================

    @POST
    @Path("/{id}/roles/{roleId}")
    @Operation(summary = "Grant a role", description = "Granting a role that is already held succeeds without change.")
    public Response assignRole(@PathParam("id") String id, @PathParam("roleId") String roleId) {
        return userOrError(id, operations.assignRole(id, roleId, auditContext.executionContext()));
    }

    @DELETE
    @Path("/{id}/roles/{roleId}")
    @Operation(summary = "Revoke a role")
    public Response removeRole(@PathParam("id") String id, @PathParam("roleId") String roleId) {
        return userOrError(id, operations.removeRole(id, roleId, auditContext.executionContext()));
    }

    // ==================== Audit ====================

    @GET
    @Path("/{id}/audit-logs")
    @Operation(summary = "Audit entries recorded for this user, newest first")
    public Response auditLogs(@PathParam("id") String id) {
        if (operations.findById(id).isEmpty()) {
            return ApiErrors.notFound("USER_NOT_FOUND", "User not found");
        }
        List<AuditLogResource.AuditLogDto> items = auditLogRepository.findByResource("user", id, AUDIT_LIMIT)
            .stream()
            .map(AuditLogResource::toDto)
            .toList();
        return Response.ok(new AuditLogResource.AuditLogListResponse(items, items.size())).build();
    }

    // ==================== Helpers ====================

    private Response userOrError(String id, Result<?> result) {
        if (result instanceof Result.Failure<?> f) {
            return ApiErrors.toResponse(f.error());
        }
        return userOrNotFound(id);
    }

    private Response userOrNotFound(String id) {
        return operations.findById(id)
            .map(user -> Response.ok(toDto(user)).build())
            .orElse(ApiErrors.notFound("USER_NOT_FOUND", "User not found"));
    }

    public static UserDto toDto(User user) {
        return new UserDto(
            user.id,
            user.email,
            user.displayName,
            user.active,
            user.lastLoginAt,
            user.failedLoginAttempts,
            user.lockedUntil,
            user.createdAt,
            user.updatedAt,
            user.roles.stream().map(r -> new RoleRef(r.id, r.name)).toList()
        );
    }

    // ==================== Request/Response Records ====================

    public record CreateUserRequest(
        @NotBlank @Size(max = 255) String email,
        @NotBlank @Size(min = 8, max = 128) String password,
        @Size(max = 255) String displayName,
        Boolean active,
        List<String> roleIds
    ) {}

    public record UpdateUserRequest(
        @Size(max = 255) String email,
        @Size(max = 255) String displayName,
        @Size(min = 8, max = 128) String password,
        Boolean active,
        Instant lockedUntil,
        List<String> roleIds
    ) {}

    public record ResetPasswordRequest(
        @NotBlank @Size(min = 8, max = 128) String newPassword
    ) {}

    public record RoleRef(String id, String name) {}

    public record UserDto(
        String id,
        String email,
        String displayName,
        boolean active,
        Instant lastLoginAt,
        int failedLoginAttempts,
        Instant lockedUntil,
        Instant createdAt,
        Instant updatedAt,
        List<RoleRef> roles
    ) {}

    public record UserListResponse(
        List<UserDto> items,
        long total,
        int skip,
        int limit
    ) {}
}
