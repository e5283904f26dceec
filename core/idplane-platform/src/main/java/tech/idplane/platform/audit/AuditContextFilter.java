package tech.idplane.platform.audit;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.SecurityContext;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * JAX-RS filter that populates AuditContext for every request.
 *
 * The principal comes from the security context when the deployment authenticates
 * callers, otherwise from the {@code X-Performed-By} header. The correlation ID is
 * taken from {@code X-Correlation-Id}.
 */
@Provider
@Priority(Priorities.AUTHENTICATION + 10)
public class AuditContextFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AuditContextFilter.class);

    public static final String PERFORMED_BY_HEADER = "X-Performed-By";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    @Inject
    AuditContext auditContext;

    @Override
    public void filter(ContainerRequestContext ctx) {
        String principalId = null;

        SecurityContext security = ctx.getSecurityContext();
        if (security != null && security.getUserPrincipal() != null) {
            principalId = security.getUserPrincipal().getName();
        }
        if (principalId == null || principalId.isBlank()) {
            principalId = ctx.getHeaderString(PERFORMED_BY_HEADER);
        }

        if (principalId != null && !principalId.isBlank()) {
            auditContext.setPrincipalId(principalId.trim());
        }
        auditContext.setCorrelationId(ctx.getHeaderString(CORRELATION_ID_HEADER));

        LOG.debugf("Audit context set for principal: %s on path: %s",
            auditContext.getPrincipalId(), ctx.getUriInfo().getPath());
    }
}
