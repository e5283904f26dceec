package tech.idplane.platform.sync.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idplane.platform.audit.AuditContext;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.sync.ClientSyncReport;
import tech.idplane.platform.sync.ClientSyncService;

/**
 * Bulk reconciliation and connectivity of the authorization server.
 */
@Path("/hydra")
@Tag(name = "Authorization Server", description = "Client registry reconciliation")
@Produces(MediaType.APPLICATION_JSON)
public class HydraResource {

    @Inject
    ClientSyncService syncService;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    AuditContext auditContext;

    /**
     * Always answers 200; partial failure is reported through {@code success} and {@code errors}.
     */
    @POST
    @Path("/sync")
    @Operation(summary = "Reconcile every client with the local service accounts",
        description = "Creates missing clients, updates drifted ones and deletes clients with no local account.")
    @APIResponse(responseCode = "200", description = "Pass finished, possibly with errors",
        content = @Content(schema = @Schema(implementation = ClientSyncReport.class)))
    public ClientSyncReport sync() {
        return syncService.syncAll(auditContext.executionContext()).toReport();
    }

    @GET
    @Path("/status")
    @Operation(summary = "Readiness of the authorization server admin API")
    public StatusResponse status() {
        boolean connected = idpClient.healthCheck();
        return new StatusResponse(connected, connected ? "connected" : "disconnected");
    }

    public record StatusResponse(boolean hydraConnected, String status) {}
}
