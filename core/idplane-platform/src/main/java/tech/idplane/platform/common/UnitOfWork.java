package tech.idplane.platform.common;

/**
 * Unit of Work for local state changes.
 *
 * <p>Runs the repository changes and writes the audit log entry within one
 * database transaction. Remote calls to the authorization server never happen
 * inside a unit of work: a use case commits locally first and talks to the remote
 * side afterwards, compensating with a second commit where needed.
 *
 * <p>Usage in a use case:
 * <pre>{@code
 * ServiceAccountCreated event = ServiceAccountCreated.fromContext(ctx)
 *     .serviceAccountId(sa.id)
 *     .build();
 *
 * Result<ServiceAccountCreated> result = unitOfWork.commit(
 *     () -> repository.persist(sa), event, command);
 * }</pre>
 */
public interface UnitOfWork {

    /**
     * Apply the changes and record the event atomically.
     *
     * <p>If the changes or the audit write fail the whole transaction is rolled back.
     * A unique key violation is reported as a {@code ConflictError}, anything else
     * as a {@code CommitError}.
     *
     * @param changes repository calls to run inside the transaction
     * @param event   the domain event describing what happened
     * @param command the command that was executed (stored on the audit entry)
     * @param <T>     the domain event type
     * @return Success with the event, or Failure if the transaction failed
     */
    <T extends DomainEvent> Result<T> commit(Runnable changes, T event, Object command);
}
