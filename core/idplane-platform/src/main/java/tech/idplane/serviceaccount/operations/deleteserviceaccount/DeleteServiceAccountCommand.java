package tech.idplane.serviceaccount.operations.deleteserviceaccount;

/**
 * Command to delete a service account.
 *
 * @param serviceAccountId the service account ID to delete
 * @param syncToIdp        also delete the client from the authorization server (best effort)
 */
public record DeleteServiceAccountCommand(
    String serviceAccountId,
    boolean syncToIdp
) {}
