package tech.idplane.serviceaccount.operations.removescope;

/**
 * Command to revoke a scope on a service account.
 *
 * @param syncToIdp push the resulting scope string to the authorization server
 */
public record RemoveScopeCommand(
    String serviceAccountId,
    String scopeId,
    boolean syncToIdp
) {}
