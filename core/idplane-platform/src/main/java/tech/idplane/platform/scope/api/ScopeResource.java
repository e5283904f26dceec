package tech.idplane.platform.scope.api;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idplane.platform.audit.AuditContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.api.ApiErrors;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeOperations;
import tech.idplane.platform.scope.events.ScopeCreated;
import tech.idplane.platform.scope.events.ScopeDeleted;
import tech.idplane.platform.scope.events.ScopeUpdated;
import tech.idplane.platform.scope.events.ScopesActivationChanged;
import tech.idplane.platform.scope.events.ScopesDeleted;
import tech.idplane.platform.scope.operations.createscope.CreateScopeCommand;
import tech.idplane.platform.scope.operations.deletescope.DeleteScopeCommand;
import tech.idplane.platform.scope.operations.deletescopes.DeleteScopesCommand;
import tech.idplane.platform.scope.operations.updatescope.UpdateScopeCommand;
import tech.idplane.serviceaccount.api.ServiceAccountResource.ServiceAccountSummary;
import tech.idplane.serviceaccount.entity.AccountType;
import tech.idplane.serviceaccount.operations.ServiceAccountOperations;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Path("/scopes")
@Tag(name = "Scopes", description = "OAuth2 scope administration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ScopeResource {

    @Inject
    ScopeOperations scopeOperations;

    @Inject
    ServiceAccountOperations serviceAccountOperations;

    @Inject
    AuditContext auditContext;

    @GET
    @Operation(summary = "List scopes")
    public List<ScopeDto> list(@QueryParam("active_only") @DefaultValue("false") boolean activeOnly) {
        return scopeOperations.findAll(activeOnly).stream().map(ScopeResource::toDto).toList();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get scope by ID")
    public Response get(@PathParam("id") String id) {
        return scopeOperations.findById(id)
            .map(scope -> Response.ok(toDto(scope)).build())
            .orElse(ApiErrors.notFound("SCOPE_NOT_FOUND", "Scope not found"));
    }

    @GET
    @Path("/for-account-type/{type}")
    @Operation(summary = "Active scopes available to an account type")
    public Response forAccountType(@PathParam("type") String type) {
        AccountType accountType;
        try {
            accountType = AccountType.fromValue(type);
        } catch (IllegalArgumentException e) {
            return ApiErrors.toResponse(new UseCaseError.ValidationError(
                "INVALID_ACCOUNT_TYPE", e.getMessage(), Map.of("accountType", String.valueOf(type))));
        }
        List<ScopeDto> scopes = scopeOperations.findForAccountType(accountType).stream()
            .map(ScopeResource::toDto)
            .toList();
        return Response.ok(scopes).build();
    }

    @POST
    @Operation(summary = "Create scope")
    public Response create(@Valid CreateScopeRequest request) {
        Result<ScopeCreated> result = scopeOperations.createScope(
            new CreateScopeCommand(request.name(), request.description(), request.appliesTo(), request.active()),
            auditContext.executionContext()
        );
        if (result instanceof Result.Success<ScopeCreated> s) {
            Scope scope = scopeOperations.findById(s.value().scopeId()).orElseThrow();
            return Response.status(Response.Status.CREATED).entity(toDto(scope)).build();
        }
        return ApiErrors.toResponse(((Result.Failure<ScopeCreated>) result).error());
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update scope", description = "Description, account types and active flag. The name is fixed.")
    public Response update(@PathParam("id") String id, @Valid UpdateScopeRequest request) {
        Result<ScopeUpdated> result = scopeOperations.updateScope(
            new UpdateScopeCommand(id, request.description(), request.appliesTo(), request.active()),
            auditContext.executionContext()
        );
        if (result instanceof Result.Failure<ScopeUpdated> f) {
            return ApiErrors.toResponse(f.error());
        }
        return get(id);
    }

    @GET
    @Path("/{id}/services")
    @Operation(summary = "Service accounts holding the scope")
    public Response services(@PathParam("id") String id) {
        if (scopeOperations.findById(id).isEmpty()) {
            return ApiErrors.notFound("SCOPE_NOT_FOUND", "Scope not found");
        }
        List<ServiceAccountSummary> holders = serviceAccountOperations.findByScope(id).stream()
            .map(ServiceAccountSummary::of)
            .toList();
        return Response.ok(holders).build();
    }

    @POST
    @Path("/bulk/activate")
    @Operation(summary = "Activate several scopes")
    public Response activate(@Valid ScopeBulkRequest request) {
        Result<ScopesActivationChanged> result =
            scopeOperations.activateScopes(request.scopeIds(), auditContext.executionContext());
        return bulkActivationResponse(result);
    }

    @POST
    @Path("/bulk/deactivate")
    @Operation(summary = "Deactivate several scopes")
    public Response deactivate(@Valid ScopeBulkRequest request) {
        Result<ScopesActivationChanged> result =
            scopeOperations.deactivateScopes(request.scopeIds(), auditContext.executionContext());
        return bulkActivationResponse(result);
    }

    @POST
    @Path("/bulk/delete")
    @Operation(summary = "Delete several scopes",
        description = "Unknown ids are skipped. Registered clients are corrected by the next sync.")
    public Response deleteMany(@Valid ScopeBulkRequest request) {
        Result<ScopesDeleted> result = scopeOperations.deleteScopes(
            new DeleteScopesCommand(request.scopeIds()), auditContext.executionContext());
        if (result instanceof Result.Success<ScopesDeleted> s) {
            return Response.ok(new ScopeBulkResponse(s.value().scopeIds(), s.value().scopeIds().size())).build();
        }
        return ApiErrors.toResponse(((Result.Failure<ScopesDeleted>) result).error());
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete scope",
        description = "Removes the scope from every service account. Registered clients are corrected by the next sync.")
    public Response delete(@PathParam("id") String id) {
        Result<ScopeDeleted> result = scopeOperations.deleteScope(new DeleteScopeCommand(id), auditContext.executionContext());
        if (result instanceof Result.Failure<ScopeDeleted> f) {
            return ApiErrors.toResponse(f.error());
        }
        return Response.noContent().build();
    }

    private static Response bulkActivationResponse(Result<ScopesActivationChanged> result) {
        if (result instanceof Result.Success<ScopesActivationChanged> s) {
            return Response.ok(new ScopeBulkResponse(s.value().scopeIds(), s.value().scopeIds().size())).build();
        }
        return ApiErrors.toResponse(((Result.Failure<ScopesActivationChanged>) result).error());
    }

    private static ScopeDto toDto(Scope scope) {
        return new ScopeDto(scope.id, scope.name, scope.description, scope.appliesTo, scope.active,
            scope.createdAt, scope.updatedAt);
    }

    public record CreateScopeRequest(
        @NotBlank @Size(max = 255) String name,
        @Size(max = 500) String description,
        List<AccountType> appliesTo,
        Boolean active
    ) {}

    public record UpdateScopeRequest(
        @Size(max = 500) String description,
        List<AccountType> appliesTo,
        Boolean active
    ) {}

    public record ScopeBulkRequest(@NotEmpty List<String> scopeIds) {}

    public record ScopeBulkResponse(List<String> scopeIds, int count) {}

    public record ScopeDto(
        String id,
        String name,
        String description,
        List<AccountType> appliesTo,
        boolean active,
        Instant createdAt,
        Instant updatedAt
    ) {}
}
