package tech.idplane.platform.sync;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome collector for one reconciliation pass. Safe to share between workers.
 *
 * <p>Any recorded error turns {@link #isSuccess()} false; the pass keeps going.
 */
public class ClientSyncResult {

    private final List<String> clientsCreated = new ArrayList<>();
    private final List<String> clientsUpdated = new ArrayList<>();
    private final List<String> clientsDeleted = new ArrayList<>();
    private final Map<String, List<String>> scopesByClient = new TreeMap<>();
    private final List<String> errors = new ArrayList<>();

    public synchronized void created(String clientId) {
        clientsCreated.add(clientId);
    }

    public synchronized void updated(String clientId) {
        clientsUpdated.add(clientId);
    }

    public synchronized void deleted(String clientId) {
        clientsDeleted.add(clientId);
    }

    public synchronized void scopes(String clientId, List<String> scopeNames) {
        if (scopeNames != null && !scopeNames.isEmpty()) {
            scopesByClient.put(clientId, List.copyOf(new LinkedHashSet<>(scopeNames)));
        }
    }

    public synchronized void error(String message) {
        errors.add(message);
    }

    public synchronized boolean isSuccess() {
        return errors.isEmpty();
    }

    public synchronized List<String> clientsCreated() {
        return List.copyOf(clientsCreated);
    }

    public synchronized List<String> clientsUpdated() {
        return List.copyOf(clientsUpdated);
    }

    public synchronized List<String> clientsDeleted() {
        return List.copyOf(clientsDeleted);
    }

    public synchronized List<String> errors() {
        return List.copyOf(errors);
    }

    /**
     * Distinct scope names held by any reconciled client, sorted.
     */
    public synchronized List<String> scopesSynced() {
        TreeSet<String> names = new TreeSet<>();
        scopesByClient.values().forEach(names::addAll);
        return List.copyOf(names);
    }

    public synchronized Map<String, List<String>> scopesByClient() {
        return new LinkedHashMap<>(scopesByClient);
    }

    /**
     * Snapshot in the shape returned by the sync endpoint.
     */
    public synchronized ClientSyncReport toReport() {
        List<String> scopes = scopesSynced();
        return new ClientSyncReport(
            isSuccess(),
            new ClientSyncReport.Summary(
                clientsCreated.size(),
                clientsUpdated.size(),
                clientsDeleted.size(),
                scopes.size(),
                errors.size()
            ),
            new ClientSyncReport.Details(
                clientsCreated(),
                clientsUpdated(),
                clientsDeleted(),
                scopes,
                scopesByClient(),
                errors()
            )
        );
    }
}
