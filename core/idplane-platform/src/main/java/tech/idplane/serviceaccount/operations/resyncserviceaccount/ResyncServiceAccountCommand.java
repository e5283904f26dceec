package tech.idplane.serviceaccount.operations.resyncserviceaccount;

public record ResyncServiceAccountCommand(String serviceAccountId) {}
