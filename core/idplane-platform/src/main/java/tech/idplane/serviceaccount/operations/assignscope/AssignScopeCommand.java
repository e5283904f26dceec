package tech.idplane.serviceaccount.operations.assignscope;

/**
 * Command to grant a scope on a service account.
 *
 * @param syncToIdp push the resulting scope string to the authorization server
 */
public record AssignScopeCommand(
    String serviceAccountId,
    String scopeId,
    boolean syncToIdp
) {}
