package tech.idplane.serviceaccount.api;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.*;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.idplane.platform.audit.AuditContext;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.api.ApiErrors;
import tech.idplane.platform.common.api.ErrorResponse;
import tech.idplane.serviceaccount.entity.AccountType;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.operations.ServiceAccountOperations;
import tech.idplane.serviceaccount.operations.createserviceaccount.CreateServiceAccountCommand;
import tech.idplane.serviceaccount.operations.createserviceaccount.ServiceAccountCreated;
import tech.idplane.serviceaccount.operations.resyncserviceaccount.ServiceAccountResynced;
import tech.idplane.serviceaccount.operations.updateserviceaccount.ServiceAccountUpdated;
import tech.idplane.serviceaccount.operations.updateserviceaccount.UpdateServiceAccountCommand;
import tech.idplane.serviceaccount.repository.ServiceAccountFilter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * API for service account management.
 *
 * Every mutation is mirrored to the authorization server:
 * - create rolls back locally when the client cannot be registered (503)
 * - update and scope changes keep the local change when the push fails (503,
 *   the database already holds the new values; run /sync later)
 * - delete never fails because of the authorization server
 */
@Path("/service-accounts")
@Tag(name = "Service Accounts", description = "Service account management mirrored to the authorization server")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ServiceAccountResource {

    private static final Logger LOG = Logger.getLogger(ServiceAccountResource.class);

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    @Inject
    ServiceAccountOperations operations;

    @Inject
    AuditContext auditContext;

    // ==================== CRUD Operations ====================

    @GET
    @Operation(summary = "List service accounts", description = "Paged list with optional search over client id, name and description")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Page of service accounts",
            content = @Content(schema = @Schema(implementation = ServiceAccountListResponse.class)))
    })
    public Response list(
            @QueryParam("skip") @DefaultValue("0") @Parameter(description = "Rows to skip") int skip,
            @QueryParam("limit") @DefaultValue("100") @Parameter(description = "Page size, at most 1000") int limit,
            @QueryParam("active_only") @DefaultValue("false") @Parameter(description = "Only active accounts") boolean activeOnly,
            @QueryParam("search") @Parameter(description = "Case-insensitive substring") String search) {

        int safeSkip = Math.max(0, skip);
        int safeLimit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        ServiceAccountFilter filter = new ServiceAccountFilter(search, activeOnly, safeSkip, safeLimit);

        List<ServiceAccountDto> items = operations.findWithFilter(filter).stream()
            .map(ServiceAccountResource::toDto)
            .toList();
        long total = operations.countWithFilter(filter);

        return Response.ok(new ServiceAccountListResponse(items, total, safeSkip, safeLimit)).build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get service account by ID")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Service account details",
            content = @Content(schema = @Schema(implementation = ServiceAccountDto.class))),
        @APIResponse(responseCode = "404", description = "Service account not found")
    })
    public Response getById(@PathParam("id") String id) {
        return operations.findById(id)
            .map(sa -> Response.ok(toDto(sa)).build())
            .orElse(ApiErrors.notFound("SERVICE_ACCOUNT_NOT_FOUND", "Service account not found"));
    }

    @GET
    @Path("/by-client-id/{clientId}")
    @Operation(summary = "Get service account by OAuth2 client ID")
    public Response getByClientId(@PathParam("clientId") String clientId) {
        return operations.findByClientId(clientId)
            .map(sa -> Response.ok(toDto(sa)).build())
            .orElse(ApiErrors.notFound("SERVICE_ACCOUNT_NOT_FOUND", "Service account not found"));
    }

    @POST
    @Operation(summary = "Create a service account",
        description = "Stores the account and registers the client. If registration fails the account is removed again.")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Service account created",
            content = @Content(schema = @Schema(implementation = ServiceAccountDto.class))),
        @APIResponse(responseCode = "404", description = "Referenced role or scope not found"),
        @APIResponse(responseCode = "409", description = "client_id already exists"),
        @APIResponse(responseCode = "422", description = "Invalid field value"),
        @APIResponse(responseCode = "503", description = "Client could not be registered; nothing was stored",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Response create(@Valid CreateServiceAccountRequest request, @Context UriInfo uriInfo) {
        ExecutionContext context = auditContext.executionContext();

        CreateServiceAccountCommand command = CreateServiceAccountCommand.builder()
            .clientId(request.clientId())
            .clientSecret(request.clientSecret())
            .clientName(request.clientName())
            .description(request.description())
            .accountType(request.accountType())
            .grantTypes(request.grantTypes())
            .responseTypes(request.responseTypes())
            .tokenEndpointAuthMethod(request.tokenEndpointAuthMethod())
            .tokenEndpointAuthSigningAlg(request.tokenEndpointAuthSigningAlg())
            .audience(request.audience())
            .redirectUris(request.redirectUris())
            .postLogoutRedirectUris(request.postLogoutRedirectUris())
            .allowedCorsOrigins(request.allowedCorsOrigins())
            .skipConsent(request.skipConsent())
            .owner(request.owner())
            .clientMetadata(request.clientMetadata())
            .jwks(request.jwks())
            .jwksUri(request.jwksUri())
            .idTokenSignedResponseAlg(request.idTokenSignedResponseAlg())
            .roleIds(request.roleIds())
            .scopeIds(request.scopeIds())
            .createdBy(request.createdBy() != null ? request.createdBy() : context.principalId())
            .syncToIdp(true)
            .build();

        Result<ServiceAccountCreated> result = operations.create(command, context);

        if (result instanceof Result.Success<ServiceAccountCreated> s) {
            LOG.infof("Service account created: %s by principal %s", request.clientId(), context.principalId());
            ServiceAccount sa = operations.findById(s.value().serviceAccountId()).orElseThrow();
            return Response.status(Response.Status.CREATED)
                .entity(toDto(sa))
                .location(uriInfo.getBaseUriBuilder()
                    .path(ServiceAccountResource.class)
                    .path(sa.id)
                    .build())
                .build();
        }
        return ApiErrors.toResponse(((Result.Failure<ServiceAccountCreated>) result).error());
    }

    @PUT
    @Path("/{id}")
    @Operation(summary = "Update a service account",
        description = "Partial update. roleIds and scopeIds replace the whole set. A 503 means the local "
            + "change WAS stored but the authorization server still holds the old client.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Service account updated",
            content = @Content(schema = @Schema(implementation = ServiceAccountDto.class))),
        @APIResponse(responseCode = "404", description = "Service account, role or scope not found"),
        @APIResponse(responseCode = "503", description = "Stored locally, remote update failed")
    })
    public Response update(
            @PathParam("id") String id,
            @QueryParam("sync_to_hydra") @DefaultValue("true") boolean syncToHydra,
            @Valid UpdateServiceAccountRequest request) {

        ExecutionContext context = auditContext.executionContext();

        UpdateServiceAccountCommand command = UpdateServiceAccountCommand.builder()
            .serviceAccountId(id)
            .clientSecret(request.clientSecret())
            .clientName(request.clientName())
            .description(request.description())
            .accountType(request.accountType())
            .grantTypes(request.grantTypes())
            .responseTypes(request.responseTypes())
            .tokenEndpointAuthMethod(request.tokenEndpointAuthMethod())
            .tokenEndpointAuthSigningAlg(request.tokenEndpointAuthSigningAlg())
            .audience(request.audience())
            .redirectUris(request.redirectUris())
            .postLogoutRedirectUris(request.postLogoutRedirectUris())
            .allowedCorsOrigins(request.allowedCorsOrigins())
            .skipConsent(request.skipConsent())
            .owner(request.owner())
            .clientMetadata(request.clientMetadata())
            .jwks(request.jwks())
            .jwksUri(request.jwksUri())
            .idTokenSignedResponseAlg(request.idTokenSignedResponseAlg())
            .active(request.active())
            .roleIds(request.roleIds())
            .scopeIds(request.scopeIds())
            .syncToIdp(syncToHydra)
            .build();

        return accountOrError(id, operations.update(command, context));
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a service account",
        description = "The client is removed from the authorization server on a best-effort basis; the local delete always proceeds.")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Deleted"),
        @APIResponse(responseCode = "404", description = "Service account not found")
    })
    public Response delete(
            @PathParam("id") String id,
            @QueryParam("sync_to_hydra") @DefaultValue("true") boolean syncToHydra) {

        var result = operations.delete(id, syncToHydra, auditContext.executionContext());
        if (result instanceof Result.Failure<?> f) {
            return ApiErrors.toResponse(f.error());
        }
        return Response.noContent().build();
    }

    // ==================== Roles and Scopes ====================

    @POST
    @Path("/{id}/roles/{roleId}")
    @Operation(summary = "Grant a role", description = "Granting a role that is already held succeeds without change.")
    public Response assignRole(@PathParam("id") String id, @PathParam("roleId") String roleId) {
        return accountOrError(id, operations.assignRole(id, roleId, auditContext.executionContext()));
    }

    @DELETE
    @Path("/{id}/roles/{roleId}")
    @Operation(summary = "Revoke a role")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Role revoked"),
        @APIResponse(responseCode = "404", description = "Account not found (SERVICE_ACCOUNT_NOT_FOUND) or role not held (ROLE_NOT_ASSIGNED)")
    })
    public Response removeRole(@PathParam("id") String id, @PathParam("roleId") String roleId) {
        return accountOrError(id, operations.removeRole(id, roleId, auditContext.executionContext()));
    }

    @POST
    @Path("/{id}/scopes/{scopeId}")
    @Operation(summary = "Grant a scope", description = "The new scope string is pushed to the authorization server.")
    public Response assignScope(@PathParam("id") String id, @PathParam("scopeId") String scopeId) {
        return accountOrError(id, operations.assignScope(id, scopeId, auditContext.executionContext()));
    }

    @DELETE
    @Path("/{id}/scopes/{scopeId}")
    @Operation(summary = "Revoke a scope")
    public Response removeScope(@PathParam("id") String id, @PathParam("scopeId") String scopeId) {
        return accountOrError(id, operations.removeScope(id, scopeId, auditContext.executionContext()));
    }

    // ==================== Lifecycle ====================

    @POST
    @Path("/{id}/activate")
    @Operation(summary = "Activate a service account")
    public Response activate(@PathParam("id") String id) {
        return accountOrError(id, operations.activate(id, auditContext.executionContext()));
    }

    @POST
    @Path("/{id}/deactivate")
    @Operation(summary = "Deactivate a service account",
        description = "Only the local flag changes; the client stays registered.")
    public Response deactivate(@PathParam("id") String id) {
        return accountOrError(id, operations.deactivate(id, auditContext.executionContext()));
    }

    @POST
    @Path("/{id}/sync")
    @Operation(summary = "Push one service account to the authorization server",
        description = "Creates the client when missing remotely, otherwise overwrites it.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Client created or updated",
            content = @Content(schema = @Schema(implementation = SyncResponse.class))),
        @APIResponse(responseCode = "404", description = "Service account not found"),
        @APIResponse(responseCode = "503", description = "Authorization server call failed")
    })
    public Response sync(@PathParam("id") String id) {
        Result<ServiceAccountResynced> result = operations.resync(id, auditContext.executionContext());
        if (result instanceof Result.Success<ServiceAccountResynced> s) {
            return Response.ok(new SyncResponse(s.value().serviceAccountId(), s.value().clientId(), s.value().action()))
                .build();
        }
        return ApiErrors.toResponse(((Result.Failure<ServiceAccountResynced>) result).error());
    }

    // ==================== Helpers ====================

    private Response accountOrError(String id, Result<?> result) {
        if (result instanceof Result.Failure<?> f) {
            return ApiErrors.toResponse(f.error());
        }
        return operations.findById(id)
            .map(sa -> Response.ok(toDto(sa)).build())
            .orElse(ApiErrors.notFound("SERVICE_ACCOUNT_NOT_FOUND", "Service account not found"));
    }

    static ServiceAccountDto toDto(ServiceAccount sa) {
        return new ServiceAccountDto(
            sa.id,
            sa.clientId,
            sa.clientName,
            sa.description,
            sa.accountType,
            sa.grantTypes,
            sa.responseTypes,
            sa.tokenEndpointAuthMethod,
            sa.tokenEndpointAuthSigningAlg,
            sa.audience,
            sa.redirectUris,
            sa.postLogoutRedirectUris,
            sa.allowedCorsOrigins,
            sa.skipConsent,
            sa.owner,
            sa.clientMetadata,
            sa.jwksUri,
            sa.idTokenSignedResponseAlg,
            sa.active,
            sa.createdBy,
            sa.lastUsedAt,
            sa.createdAt,
            sa.updatedAt,
            sa.roles.stream().map(r -> new RoleRef(r.id, r.name)).toList(),
            sa.scopes.stream().map(s -> new ScopeRef(s.id, s.name)).toList()
        );
    }

    // ==================== Request/Response Records ====================

    public record CreateServiceAccountRequest(
        @NotBlank @Size(max = 255) String clientId,
        String clientSecret,
        @NotBlank @Size(max = 255) String clientName,
        String description,
        AccountType accountType,
        List<String> grantTypes,
        List<String> responseTypes,
        String tokenEndpointAuthMethod,
        String tokenEndpointAuthSigningAlg,
        List<String> audience,
        List<String> redirectUris,
        List<String> postLogoutRedirectUris,
        List<String> allowedCorsOrigins,
        Boolean skipConsent,
        String owner,
        Map<String, Object> clientMetadata,
        Map<String, Object> jwks,
        String jwksUri,
        String idTokenSignedResponseAlg,
        List<String> roleIds,
        List<String> scopeIds,
        @Size(max = 255) String createdBy
    ) {}

    public record UpdateServiceAccountRequest(
        String clientSecret,
        @Size(max = 255) String clientName,
        String description,
        AccountType accountType,
        List<String> grantTypes,
        List<String> responseTypes,
        String tokenEndpointAuthMethod,
        String tokenEndpointAuthSigningAlg,
        List<String> audience,
        List<String> redirectUris,
        List<String> postLogoutRedirectUris,
        List<String> allowedCorsOrigins,
        Boolean skipConsent,
        String owner,
        Map<String, Object> clientMetadata,
        Map<String, Object> jwks,
        String jwksUri,
        String idTokenSignedResponseAlg,
        Boolean active,
        List<String> roleIds,
        List<String> scopeIds
    ) {}

    /**
     * Short form used when listing the holders of a role or scope.
     */
    public record ServiceAccountSummary(
        String id,
        String clientId,
        String clientName,
        AccountType accountType,
        boolean active,
        String description,
        String createdBy
    ) {

        public static ServiceAccountSummary of(ServiceAccount sa) {
            return new ServiceAccountSummary(sa.id, sa.clientId, sa.clientName, sa.accountType, sa.active,
                sa.description, sa.createdBy);
        }
    }

    public record RoleRef(String id, String name) {}

    public record ScopeRef(String id, String name) {}

    public record ServiceAccountDto(
        String id,
        String clientId,
        String clientName,
        String description,
        AccountType accountType,
        List<String> grantTypes,
        List<String> responseTypes,
        String tokenEndpointAuthMethod,
        String tokenEndpointAuthSigningAlg,
        List<String> audience,
        List<String> redirectUris,
        List<String> postLogoutRedirectUris,
        List<String> allowedCorsOrigins,
        boolean skipConsent,
        String owner,
        Map<String, Object> clientMetadata,
        String jwksUri,
        String idTokenSignedResponseAlg,
        boolean active,
        String createdBy,
        Instant lastUsedAt,
        Instant createdAt,
        Instant updatedAt,
        List<RoleRef> roles,
        List<ScopeRef> scopes
    ) {}

    public record ServiceAccountListResponse(
        List<ServiceAccountDto> items,
        long total,
        int skip,
        int limit
    ) {}

    public record SyncResponse(
        String serviceAccountId,
        String clientId,
        String action
    ) {}
}
