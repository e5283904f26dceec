package tech.idplane.platform.common.panache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.TransactionSynchronizationRegistry;
import jakarta.transaction.Transactional;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;
import tech.idplane.platform.audit.AuditLog;
import tech.idplane.platform.audit.AuditLogRepository;
import tech.idplane.platform.common.DomainEvent;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Panache/JPA implementation of {@link UnitOfWork} using JTA transactions.
 *
 * <p>The changes, the audit log entry and the flush all happen inside one
 * transaction managed by Quarkus. On failure the transaction is marked
 * rollback-only and a failure result is returned instead of an exception.
 */
@ApplicationScoped
public class PanacheTransactionalUnitOfWork implements UnitOfWork {

    private static final Logger LOG = Logger.getLogger(PanacheTransactionalUnitOfWork.class);

    static final int MAX_DETAILS_LENGTH = 10000;

    @Inject
    EntityManager em;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    AuditLogRepository auditLogRepository;

    @Inject
    TransactionSynchronizationRegistry txSyncRegistry;

    @Override
    @Transactional
    public <T extends DomainEvent> Result<T> commit(Runnable changes, T event, Object command) {
        try {
            changes.run();
            auditLogRepository.persist(toAuditLog(event, command));
            em.flush();

            LOG.debugf("Committed [%s] for %s %s", event.eventType(), event.resourceType(), event.resourceId());
            return Result.success(event);

        } catch (Exception e) {
            txSyncRegistry.setRollbackOnly();

            ConstraintViolationException violation = findConstraintViolation(e);
            if (violation != null) {
                LOG.warnf("Unique constraint violated while committing [%s]: %s",
                    event.eventType(), violation.getConstraintName());
                return Result.failure(new UseCaseError.ConflictError(
                    "DUPLICATE_KEY",
                    "A record with the same unique key already exists",
                    Map.of("constraint", String.valueOf(violation.getConstraintName()))
                ));
            }

            LOG.errorf(e, "Failed to commit [%s]", event.eventType());
            return Result.failure(new UseCaseError.CommitError(
                "COMMIT_FAILED",
                "Failed to commit transaction: " + e.getMessage(),
                Map.of("exception", e.getClass().getSimpleName())
            ));
        }
    }

    private AuditLog toAuditLog(DomainEvent event, Object command) throws JsonProcessingException {
        AuditLog auditLog = new AuditLog();
        auditLog.action = event.eventType();
        auditLog.resourceType = event.resourceType();
        auditLog.resourceId = event.resourceId();
        String details = objectMapper.writeValueAsString(command);
        auditLog.details = details.length() > MAX_DETAILS_LENGTH ? details.substring(0, MAX_DETAILS_LENGTH) : details;
        auditLog.performedBy = event.principalId();
        auditLog.correlationId = event.correlationId();
        auditLog.performedAt = event.time();
        return auditLog;
    }

    private static ConstraintViolationException findConstraintViolation(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ConstraintViolationException cve) {
                return cve;
            }
            current = current.getCause();
        }
        return null;
    }
}
