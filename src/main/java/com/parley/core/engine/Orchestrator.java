package com.parley.core.engine;

import com.parley.core.action.ActionChannel;
import com.parley.core.action.OutboundAction;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.config.ParleyProperties;
import com.parley.core.lifecycle.PersistentWorkerManager;
import com.parley.core.mailbox.MailboxPoller;
import com.parley.core.model.InboundEvent;
import com.parley.core.router.RequestRouter;
import com.parley.core.scheduler.TaskScheduler;
import com.parley.core.store.NamespaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the running control plane: the persistent worker, the mailbox poller, the scheduler
 * and the router, all driven by one {@link OrchestratorLoop}.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final ParleyProperties properties;
    private final OrchestratorLoop loop;
    private final NamespaceRegistry namespaces;
    private final RequestRouter router;
    private final PersistentWorkerManager persistentWorker;
    private final MailboxPoller mailboxPoller;
    private final TaskScheduler scheduler;
    private final ActionChannel actions;

    private volatile boolean running;

    public Orchestrator(ParleyProperties properties, OrchestratorLoop loop, NamespaceRegistry namespaces,
                        RequestRouter router, PersistentWorkerManager persistentWorker,
                        MailboxPoller mailboxPoller, TaskScheduler scheduler, ActionChannel actions) {
        this.properties = properties;
        this.loop = loop;
        this.namespaces = namespaces;
        this.router = router;
        this.persistentWorker = persistentWorker;
        this.mailboxPoller = mailboxPoller;
        this.scheduler = scheduler;
        this.actions = actions;
    }

    public CompletableFuture<Void> start() {
        return loop.submit(() -> {
            if (running) {
                log.debug("Orchestrator already running");
                return null;
            }
            bootstrapPrivilegedNamespace();
            var privileged = namespaces.byFolder(properties.getPrivileged().getFolder());
            if (properties.getPersistent().isEnabled() && privileged.isPresent()) {
                persistentWorker.start(privileged.get());
            } else if (privileged.isEmpty()) {
                log.warn("Privileged namespace '{}' is not registered yet; persistent worker not started",
                        properties.getPrivileged().getFolder());
            }
            mailboxPoller.start();
            scheduler.start();
            router.recover();
            running = true;
            log.info("Orchestrator started ({} registered namespace(s))", namespaces.all().size());
            return null;
        });
    }

    /** Accepts an event from the platform adapter. Safe from any thread. */
    public CompletableFuture<Void> accept(InboundEvent event) {
        return router.submit(event);
    }

    public void shutdown() {
        if (!running) {
            loop.shutdown(Duration.ofSeconds(1));
            return;
        }
        log.info("Orchestrator shutting down");
        var stopped = loop.submit(() -> {
            running = false;
            mailboxPoller.stop();
            scheduler.stop();
            router.cancelAll();
            return persistentWorker.shutdown();
        }).thenCompose(f -> f);
        try {
            stopped.get(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Orchestrator did not shut down cleanly: {}", e.getMessage());
        }
        loop.shutdown(Duration.ofSeconds(2));
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Registers the privileged namespace from configuration when a conversation key is set
     * and nothing has registered that folder yet.
     */
    private void bootstrapPrivilegedNamespace() {
        var config = properties.getPrivileged();
        if (config.getConversationKey() == null || config.getConversationKey().isBlank()) {
            return;
        }
        if (namespaces.byFolder(config.getFolder()).isPresent()) {
            return;
        }
        log.info("Registering privileged namespace {} for {}", config.getFolder(), config.getConversationKey());
        actions.publish(new OutboundAction.RegisterNamespace(config.getConversationKey(), config.getName(),
                config.getFolder(), "@" + properties.getAssistantName(), null));
    }
}
