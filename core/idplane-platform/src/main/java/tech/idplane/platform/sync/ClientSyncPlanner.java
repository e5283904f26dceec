package tech.idplane.platform.sync;

import tech.idplane.platform.idp.RemoteClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The directional sync rule: the local database is the source of truth.
 *
 * <p>Local clients absent remotely are created, clients present on both sides are
 * updated when {@link ClientDrift} finds a difference, and remote clients with no
 * local counterpart are deleted. Pure; performs no I/O.
 */
public final class ClientSyncPlanner {

    private ClientSyncPlanner() {
    }

    /**
     * @param desired desired clients derived from local service accounts, keyed by client id
     * @param remote  clients currently registered remotely, keyed by client id
     */
    public static ClientSyncPlan plan(Map<String, RemoteClient> desired, Map<String, RemoteClient> remote) {
        List<RemoteClient> toCreate = new ArrayList<>();
        List<RemoteClient> toUpdate = new ArrayList<>();
        List<String> toDelete = new ArrayList<>();

        desired.forEach((clientId, client) -> {
            RemoteClient existing = remote.get(clientId);
            if (existing == null) {
                toCreate.add(client);
            } else if (ClientDrift.hasDrift(client, existing)) {
                toUpdate.add(client);
            }
        });
        remote.keySet().stream()
            .filter(clientId -> !desired.containsKey(clientId))
            .forEach(toDelete::add);

        return new ClientSyncPlan(List.copyOf(toCreate), List.copyOf(toUpdate), List.copyOf(toDelete));
    }
}
