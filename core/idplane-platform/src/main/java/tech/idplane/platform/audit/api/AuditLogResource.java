package tech.idplane.platform.audit.api;

import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idplane.platform.audit.AuditLog;
import tech.idplane.platform.audit.AuditLogRepository;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to audit logs, newest first.
 */
@Path("/audit-logs")
@Tag(name = "Audit Logs", description = "Audit trail of every mutation")
@Produces(MediaType.APPLICATION_JSON)
public class AuditLogResource {

    static final int MAX_LIMIT = 500;

    @Inject
    AuditLogRepository auditLogRepository;

    @GET
    @Operation(summary = "List audit logs")
    public AuditLogListResponse list(
            @QueryParam("resourceType") @Parameter(description = "Filter by resource type") String resourceType,
            @QueryParam("resourceId") @Parameter(description = "Filter by resource ID (requires resourceType)") String resourceId,
            @QueryParam("limit") @DefaultValue("100") int limit) {

        int safeLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        List<AuditLog> logs;
        if (resourceType != null && resourceId != null) {
            logs = auditLogRepository.findByResource(resourceType, resourceId, safeLimit);
        } else if (resourceType != null) {
            logs = auditLogRepository.findByResourceType(resourceType, safeLimit);
        } else {
            logs = auditLogRepository.findRecent(safeLimit);
        }

        List<AuditLogDto> items = logs.stream().map(AuditLogResource::toDto).toList();
        return new AuditLogListResponse(items, items.size());
    }

    public static AuditLogDto toDto(AuditLog log) {
        return new AuditLogDto(log.id, log.action, log.resourceType, log.resourceId, log.details,
            log.performedBy, log.correlationId, log.performedAt);
    }

    public record AuditLogDto(
        String id,
        String action,
        String resourceType,
        String resourceId,
        String details,
        String performedBy,
        String correlationId,
        Instant performedAt
    ) {}

    public record AuditLogListResponse(List<AuditLogDto> items, int total) {}
}
