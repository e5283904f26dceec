package tech.idplane.platform.audit;

import jakarta.enterprise.context.RequestScoped;
import tech.idplane.platform.common.ExecutionContext;

/**
 * Request-scoped context holding the current principal for audit logging.
 *
 * Can be populated:
 * - Automatically via AuditContextFilter (for HTTP requests)
 * - Manually via setPrincipalId() for tests
 *
 * When nothing identifies the caller the SYSTEM principal is used.
 */
@RequestScoped
public class AuditContext {

    public static final String SYSTEM_PRINCIPAL = "system";

    private String principalId;
    private String correlationId;

    public void setPrincipalId(String principalId) {
        this.principalId = principalId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
    }

    /**
     * Get the current principal ID, falling back to the system principal.
     */
    public String getPrincipalId() {
        return principalId != null ? principalId : SYSTEM_PRINCIPAL;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public boolean isSystemPrincipal() {
        return principalId == null;
    }

    /**
     * Execution context for a use case run on behalf of the current request.
     */
    public ExecutionContext executionContext() {
        return ExecutionContext.withCorrelation(getPrincipalId(), correlationId);
    }
}
