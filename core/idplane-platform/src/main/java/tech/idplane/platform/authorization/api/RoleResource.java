package tech.idplane.platform.authorization.api;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idplane.platform.audit.AuditContext;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleOperations;
import tech.idplane.platform.authorization.events.RoleCreated;
import tech.idplane.platform.authorization.events.RoleDeleted;
import tech.idplane.platform.authorization.events.RoleUpdated;
import tech.idplane.platform.authorization.operations.createrole.CreateRoleCommand;
import tech.idplane.platform.authorization.operations.deleterole.DeleteRoleCommand;
import tech.idplane.platform.authorization.operations.updaterole.UpdateRoleCommand;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.api.ApiErrors;
import tech.idplane.serviceaccount.api.ServiceAccountResource.ServiceAccountSummary;
import tech.idplane.serviceaccount.operations.ServiceAccountOperations;
import tech.idplane.user.api.UserResource;
import tech.idplane.user.operations.UserOperations;

import java.time.Instant;
import java.util.List;

/**
 * Role administration. Roles are local only and are never sent to the authorization
 * server, so renaming or deleting one needs no remote call.
 */
@Path("/roles")
@Tag(name = "Roles", description = "Role administration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RoleResource {

    @Inject
    RoleOperations roleOperations;

    @Inject
    ServiceAccountOperations serviceAccountOperations;

    @Inject
    UserOperations userOperations;

    @Inject
    AuditContext auditContext;

    @GET
    @Operation(summary = "List roles")
    public List<RoleDto> list() {
        return roleOperations.findAll().stream().map(RoleResource::toDto).toList();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get role by ID")
    public Response get(@PathParam("id") String id) {
        return roleOperations.findById(id)
            .map(role -> Response.ok(toDto(role)).build())
            .orElse(ApiErrors.notFound("ROLE_NOT_FOUND", "Role not found"));
    }

    @POST
    @Operation(summary = "Create role")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Role created"),
        @APIResponse(responseCode = "409", description = "Role name already exists")
    })
    public Response create(@Valid CreateRoleRequest request) {
        Result<RoleCreated> result = roleOperations.createRole(
            new CreateRoleCommand(request.name(), request.description()),
            auditContext.executionContext()
        );
        if (result instanceof Result.Success<RoleCreated> s) {
            Role role = roleOperations.findById(s.value().roleId()).orElseThrow();
            return Response.status(Response.Status.CREATED).entity(toDto(role)).build();
        }
        return ApiErrors.toResponse(((Result.Failure<RoleCreated>) result).error());
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update role", description = "Partial update of name and description.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Role updated"),
        @APIResponse(responseCode = "404", description = "Role not found"),
        @APIResponse(responseCode = "409", description = "Role name already exists")
    })
    public Response update(@PathParam("id") String id, @Valid UpdateRoleRequest request) {
        Result<RoleUpdated> result = roleOperations.updateRole(
            new UpdateRoleCommand(id, request.name(), request.description()),
            auditContext.executionContext()
        );
        if (result instanceof Result.Failure<RoleUpdated> f) {
            return ApiErrors.toResponse(f.error());
        }
        return get(id);
    }

    @GET
    @Path("/{id}/services")
    @Operation(summary = "Service accounts holding the role")
    public Response services(@PathParam("id") String id) {
        if (roleOperations.findById(id).isEmpty()) {
            return ApiErrors.notFound("ROLE_NOT_FOUND", "Role not found");
        }
        List<ServiceAccountSummary> holders = serviceAccountOperations.findByRole(id).stream()
            .map(ServiceAccountSummary::of)
            .toList();
        return Response.ok(holders).build();
    }

    @GET
    @Path("/{id}/users")
    @Operation(summary = "Users holding the role")
    public Response users(@PathParam("id") String id) {
        if (roleOperations.findById(id).isEmpty()) {
            return ApiErrors.notFound("ROLE_NOT_FOUND", "Role not found");
        }
        List<UserResource.UserDto> holders = userOperations.findByRole(id).stream()
            .map(UserResource::toDto)
            .toList();
        return Response.ok(holders).build();
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete role", description = "The role is revoked from every service account and user holding it.")
    public Response delete(@PathParam("id") String id) {
        Result<RoleDeleted> result = roleOperations.deleteRole(new DeleteRoleCommand(id), auditContext.executionContext());
        if (result instanceof Result.Failure<RoleDeleted> f) {
            return ApiErrors.toResponse(f.error());
        }
        return Response.noContent().build();
    }

    private static RoleDto toDto(Role role) {
        return new RoleDto(role.id, role.name, role.description, role.createdAt, role.updatedAt);
    }

    public record CreateRoleRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String description
    ) {}

    public record UpdateRoleRequest(
        @Size(max = 100) String name,
        @Size(max = 500) String description
    ) {}

    public record RoleDto(
        String id,
        String name,
        String description,
        Instant createdAt,
        Instant updatedAt
    ) {}
}
