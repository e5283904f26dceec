package tech.idplane.platform.sync;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.RemoteClient;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.mapper.RemoteClientMapper;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Converges the authorization server's client registry to the local service accounts.
 *
 * <p>A pass loads both sides, plans with {@link ClientSyncPlanner}, then runs the
 * create, update and delete phases one after another. Entries inside a phase run on
 * a bounded worker pool shared by all passes. A failed entry is recorded on the
 * {@link ClientSyncResult} and never stops the others. If either side cannot be loaded nothing is changed
 * remotely and the pass ends unsuccessful.
 *
 * <p>Two passes racing each other are not coordinated; the last write wins remotely.
 */
@ApplicationScoped
public class ClientSyncService {

    private static final Logger LOG = Logger.getLogger(ClientSyncService.class);

    @Inject
    ServiceAccountRepository serviceAccountRepository;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    SyncConfig config;

    @Inject
    UnitOfWork unitOfWork;

    private ExecutorService workers;

    @PostConstruct
    void init() {
        workers = Executors.newFixedThreadPool(Math.max(1, config.parallelism()));
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public ClientSyncResult syncAll(ExecutionContext context) {
        LOG.info("Starting client synchronization");
        ClientSyncResult result = new ClientSyncResult();

        List<ServiceAccount> accounts;
        List<RemoteClient> remoteClients;
        try {
            accounts = loadLocalAccounts();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to load local service accounts");
            result.error("Failed to load local service accounts: " + e.getMessage());
            return finish(result, context);
        }
        try {
            remoteClients = idpClient.listAllClients();
        } catch (RuntimeException e) {
            LOG.errorf("Failed to list remote clients: %s", e.getMessage());
            result.error("Failed to list remote clients: " + e.getMessage());
            return finish(result, context);
        }

        Map<String, RemoteClient> desired = new LinkedHashMap<>();
        for (ServiceAccount sa : accounts) {
            desired.put(sa.clientId, RemoteClientMapper.toRemoteClient(sa));
            result.scopes(sa.clientId, sa.scopeNames());
        }
        Map<String, RemoteClient> remote = new LinkedHashMap<>();
        for (RemoteClient client : remoteClients) {
            if (client.clientId() != null) {
                remote.put(client.clientId(), client);
            }
        }

        ClientSyncPlan plan = ClientSyncPlanner.plan(desired, remote);
        LOG.infof("Sync plan: %d to create, %d to update, %d to delete (local=%d, remote=%d)",
            plan.toCreate().size(), plan.toUpdate().size(), plan.toDelete().size(),
            desired.size(), remote.size());

        runPhase(result, plan.toCreate(), "create", client -> {
            idpClient.createClient(client);
            result.created(client.clientId());
        });
        runPhase(result, plan.toUpdate(), "update", client -> {
            idpClient.updateClient(client.clientId(), client);
            result.updated(client.clientId());
        });
        runPhase(result, toIdOnly(plan.toDelete()), "delete", client -> {
            idpClient.deleteClient(client.clientId());
            result.deleted(client.clientId());
        });

        return finish(result, context);
    }

    /**
     * Read every local account page by page. A partial listing would make live
     * accounts look like orphans, so there is no overall cap.
     */
    private List<ServiceAccount> loadLocalAccounts() {
        int pageSize = Math.max(1, config.localPageSize());
        List<ServiceAccount> accounts = new ArrayList<>();
        String after = null;
        while (true) {
            List<ServiceAccount> page = serviceAccountRepository.listPage(after, pageSize);
            accounts.addAll(page);
            if (page.size() < pageSize) {
                return accounts;
            }
            after = page.get(page.size() - 1).clientId;
        }
    }

    private void runPhase(ClientSyncResult result, List<RemoteClient> clients,
                          String action, Consumer<RemoteClient> apply) {
        if (clients.isEmpty() || Thread.currentThread().isInterrupted()) {
            return;
        }
        List<Callable<Void>> tasks = new ArrayList<>(clients.size());
        for (RemoteClient client : clients) {
            tasks.add(() -> {
                try {
                    apply.accept(client);
                    LOG.infof("Client %s: %sd", client.clientId(), action);
                } catch (RuntimeException e) {
                    String message = "Failed to " + action + " client " + client.clientId() + ": " + e.getMessage();
                    LOG.error(message);
                    result.error(message);
                }
                return null;
            });
        }
        try {
            workers.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Client synchronization interrupted during %s phase", action);
            result.error("Synchronization interrupted during " + action + " phase");
        }
    }

    private ClientSyncResult finish(ClientSyncResult result, ExecutionContext context) {
        ClientSyncReport report = result.toReport();
        ClientsSynced event = ClientsSynced.fromContext(context)
            .success(report.success())
            .clientsCreated(report.summary().clientsCreated())
            .clientsUpdated(report.summary().clientsUpdated())
            .clientsDeleted(report.summary().clientsDeleted())
            .errors(report.summary().errors())
            .build();
        Result<ClientsSynced> audited = unitOfWork.commit(() -> { }, event, report);
        if (audited instanceof Result.Failure<ClientsSynced> f) {
            LOG.warnf("Could not record sync audit entry: %s", f.error().message());
        }

        LOG.infof("Client synchronization finished: success=%s created=%d updated=%d deleted=%d errors=%d",
            report.success(), report.summary().clientsCreated(), report.summary().clientsUpdated(),
            report.summary().clientsDeleted(), report.summary().errors());
        return result;
    }

    private static List<RemoteClient> toIdOnly(List<String> clientIds) {
        return clientIds.stream()
            .map(id -> RemoteClient.builder().clientId(id).build())
            .toList();
    }
}
