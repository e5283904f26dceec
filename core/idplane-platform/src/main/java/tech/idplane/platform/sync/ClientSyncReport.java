package tech.idplane.platform.sync;

import java.util.List;
import java.util.Map;

/**
 * Immutable report of a reconciliation pass.
 */
public record ClientSyncReport(
    boolean success,
    Summary summary,
    Details details
) {

    public record Summary(
        int clientsCreated,
        int clientsUpdated,
        int clientsDeleted,
        int scopesSynced,
        int errors
    ) {}

    public record Details(
        List<String> clientsCreated,
        List<String> clientsUpdated,
        List<String> clientsDeleted,
        List<String> scopesSynced,
        Map<String, List<String>> scopesByClient,
        List<String> errors
    ) {}
}
