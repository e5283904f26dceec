package tech.idplane.platform.sync;

import tech.idplane.platform.idp.RemoteClient;

import java.util.List;

/**
 * What a reconciliation pass has to do, keyed by client id.
 *
 * @param toCreate desired clients missing remotely
 * @param toUpdate desired clients whose remote counterpart has drifted
 * @param toDelete client ids registered remotely with no local service account
 */
public record ClientSyncPlan(
    List<RemoteClient> toCreate,
    List<RemoteClient> toUpdate,
    List<String> toDelete
) {

    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
    }
}
