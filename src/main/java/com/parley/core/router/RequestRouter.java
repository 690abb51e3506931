package com.parley.core.router;

import com.parley.core.action.ActionChannel;
import com.parley.core.action.OutboundAction;
import com.parley.core.concurrent.CancellationToken;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.config.ParleyProperties;
import com.parley.core.lifecycle.PersistentWorkerManager;
import com.parley.core.logging.MdcContext;
import com.parley.core.mailbox.SnapshotWriter;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.ConversationMessage;
import com.parley.core.model.InboundEvent;
import com.parley.core.model.Provenance;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.store.MessageStore;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.SessionRegistry;
import com.parley.core.store.WatermarkStore;
import com.parley.worker.EphemeralWorkerPool;
import com.parley.worker.WorkerInvocation;
import com.parley.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Entry point for inbound conversational events.
 *
 * <p>Keeps at most one batch in flight per conversation. An event arriving within the merge
 * window of the active batch cancels it (and the subagents it owns) and restarts with the
 * combined batch; a later event waits and starts the next batch when the active one finishes.
 * The prompt is always rebuilt from stored history since the last delivered reply, so nothing
 * is skipped across merges or restarts.
 *
 * <p>The privileged namespace goes to the persistent worker first and falls back to a one-shot
 * worker once on any failure. Everyone else gets a one-shot worker.
 *
 * <p>Loop thread only, apart from {@link #submit}.
 */
public class RequestRouter {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    static final String ROUTE_PERSISTENT = "persistent";
    static final String ROUTE_FALLBACK = "fallback";
    static final String ROUTE_EPHEMERAL = "ephemeral";

    private final ParleyProperties properties;
    private final NamespaceRegistry namespaces;
    private final SessionRegistry sessions;
    private final MessageStore messages;
    private final WatermarkStore watermarks;
    private final PersistentWorkerManager persistent;
    private final EphemeralWorkerPool ephemeral;
    private final SubagentRegistry subagents;
    private final PromptRenderer renderer;
    private final SnapshotWriter snapshots;
    private final ActionChannel actions;
    private final OrchestratorLoop loop;
    private final Clock clock;
    private final ParleyMetrics metrics;
    private final Pattern trigger;

    private final Map<String, ActiveConversationRequest> active = new HashMap<>();

    private record Dispatch(WorkerResult result, String route) {}

    public RequestRouter(ParleyProperties properties, NamespaceRegistry namespaces, SessionRegistry sessions,
                         MessageStore messages, WatermarkStore watermarks, PersistentWorkerManager persistent,
                         EphemeralWorkerPool ephemeral, SubagentRegistry subagents, PromptRenderer renderer,
                         SnapshotWriter snapshots, ActionChannel actions, OrchestratorLoop loop, Clock clock,
                         ParleyMetrics metrics) {
        this.properties = properties;
        this.namespaces = namespaces;
        this.sessions = sessions;
        this.messages = messages;
        this.watermarks = watermarks;
        this.persistent = persistent;
        this.ephemeral = ephemeral;
        this.subagents = subagents;
        this.renderer = renderer;
        this.snapshots = snapshots;
        this.actions = actions;
        this.loop = loop;
        this.clock = clock;
        this.metrics = metrics;
        this.trigger = properties.triggerPattern();
    }

    /** Thread-safe entry point: hands the event to the loop. */
    public CompletableFuture<Void> submit(InboundEvent event) {
        return loop.submit(() -> {
            handleInboundEvent(event);
            return null;
        });
    }

    public void handleInboundEvent(InboundEvent event) {
        String key = event.conversationKey();
        if (!messages.save(event.toMessage())) {
            log.debug("Ignoring duplicate event {} for {}", event.id(), key);
            return;
        }
        var namespace = namespaces.forConversation(key).orElse(null);
        if (namespace == null) {
            log.debug("Stored event {} for unregistered conversation {}", event.id(), key);
            return;
        }
        boolean privileged = namespaces.isPrivileged(namespace.folder());
        if (!privileged && !trigger.matcher(event.content().trim()).find()) {
            return;
        }

        MdcContext.setConversation(key, namespace.folder());
        try {
            Instant now = clock.instant();
            ActiveConversationRequest existing = active.get(key);
            if (existing == null) {
                start(key, namespace, List.of(event));
            } else if (Duration.between(existing.startedAt(), now).compareTo(properties.getRouter().getMergeWindow()) < 0) {
                var merged = new ArrayList<>(existing.events());
                merged.add(event);
                log.info("Merging event into active request ({} events)", merged.size());
                metrics.recordMerge();
                existing.token().cancel();
                int cancelled = subagents.cancelOwnedBy(key);
                if (cancelled > 0) {
                    metrics.setActiveSubagents(subagents.size());
                }
                start(key, namespace, merged);
            } else {
                existing.addFollowUp(event);
                log.info("Active request is past the merge window, event queued as follow-up");
            }
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Re-queues conversations with user messages newer than their last delivered reply.
     */
    public void recover() {
        int recovered = 0;
        for (String key : messages.conversationKeys()) {
            if (active.containsKey(key)) continue;
            var namespace = namespaces.forConversation(key).orElse(null);
            if (namespace == null) continue;
            boolean privileged = namespaces.isPrivileged(namespace.folder());
            boolean pending = messages.messagesSince(key, watermarks.get(key)).stream()
                    .filter(m -> m.provenance() == Provenance.USER)
                    .anyMatch(m -> privileged || trigger.matcher(m.content().trim()).find());
            if (pending) {
                log.info("Recovering unanswered messages for {}", key);
                start(key, namespace, List.of());
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("Recovered {} conversation(s) with pending messages", recovered);
        }
    }

    /**
     * Runs a scheduled prompt on a one-shot worker. Scheduled runs never take part in merging.
     */
    public CompletableFuture<WorkerResult> dispatchScheduled(RegisteredNamespace namespace, String conversationKey,
                                                             String prompt, String sessionId) {
        snapshots.write(namespace.folder());
        var invocation = new WorkerInvocation(namespace, conversationKey, renderer.scheduled(prompt), sessionId,
                namespaces.isPrivileged(namespace.folder()), true, "task");
        return ephemeral.run(invocation, new CancellationToken());
    }

    public boolean isActive(String conversationKey) {
        return active.containsKey(conversationKey);
    }

    public int activeCount() {
        return active.size();
    }

    /** Cancels everything in flight. Used on shutdown. */
    public void cancelAll() {
        active.values().forEach(r -> r.token().cancel());
        active.clear();
        subagents.cancelAll();
    }

    private void start(String key, RegisteredNamespace namespace, List<InboundEvent> events) {
        var request = new ActiveConversationRequest(key, events, new CancellationToken(), clock.instant());
        active.put(key, request);
        process(request, namespace);
    }

    private void process(ActiveConversationRequest request, RegisteredNamespace namespace) {
        String key = request.conversationKey();
        CompletableFuture<Dispatch> outcome;
        Instant newest = null;
        long startedMs = clock.millis();
        try {
            List<ConversationMessage> pending = pendingFor(request);
            if (pending.isEmpty()) {
                log.debug("Nothing new since last delivery for {}", key);
                finish(request, namespace, false);
                return;
            }
            newest = pending.get(pending.size() - 1).timestamp();
            String prompt = renderer.renderBatch(pending);
            boolean privileged = namespaces.isPrivileged(namespace.folder());
            log.info("Processing {} message(s) for {} ({})", pending.size(), key, namespace.folder());

            actions.publish(new OutboundAction.TypingStart(key));
            snapshots.write(namespace.folder());
            outcome = dispatch(namespace, key, prompt, privileged, request.token());
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        Instant deliveredUpTo = newest;
        outcome.whenComplete((dispatch, error) -> {
            MdcContext.setConversation(key, namespace.folder());
            try {
                onProcessed(request, namespace, deliveredUpTo, dispatch, unwrap(error), clock.millis() - startedMs);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Stored history since the last delivered reply, plus any of the batch's own events stamped
     * at or before that point, which arrived late and are still unanswered.
     */
    private List<ConversationMessage> pendingFor(ActiveConversationRequest request) {
        String key = request.conversationKey();
        List<ConversationMessage> since = messages.messagesSince(key, watermarks.get(key));
        Set<String> ids = new HashSet<>();
        since.forEach(m -> ids.add(m.id()));
        List<ConversationMessage> late = request.events().stream()
                .filter(e -> !ids.contains(e.id()))
                .map(InboundEvent::toMessage)
                .toList();
        if (late.isEmpty()) {
            return since;
        }
        log.info("Including {} late event(s) stamped before the last delivery for {}", late.size(), key);
        var combined = new ArrayList<>(since);
        combined.addAll(late);
        combined.sort(Comparator.comparing(ConversationMessage::timestamp));
        return combined;
    }

    private CompletableFuture<Dispatch> dispatch(RegisteredNamespace namespace, String key, String prompt,
                                                 boolean privileged, CancellationToken token) {
        String sessionId = sessions.get(namespace.folder());
        var invocation = new WorkerInvocation(namespace, key, prompt, sessionId, privileged, false, "chat");
        if (!privileged) {
            return ephemeral.run(invocation, token).thenApply(r -> new Dispatch(r, ROUTE_EPHEMERAL));
        }
        if (!persistent.isAvailable()) {
            log.info("Persistent worker {}, using one-shot worker", persistent.state().name().toLowerCase());
            return ephemeral.run(invocation, token).thenApply(r -> new Dispatch(r, ROUTE_FALLBACK));
        }
        // a persistent query cannot be stopped mid-flight; cancellation only suppresses delivery
        return persistent.query(prompt, sessionId, key)
                .handle((result, error) -> {
                    if (error == null && result.isSuccess()) {
                        return CompletableFuture.completedFuture(new Dispatch(result, ROUTE_PERSISTENT));
                    }
                    if (token.isCancelled()) {
                        return CompletableFuture.<Dispatch>failedFuture(new CancellationException("Superseded"));
                    }
                    String reason = error != null ? unwrap(error).getMessage() : result.error();
                    log.warn("Persistent worker failed ({}), falling back to one-shot worker", reason);
                    return ephemeral.run(invocation, token).thenApply(r -> new Dispatch(r, ROUTE_FALLBACK));
                })
                .thenCompose(f -> f);
    }

    private void onProcessed(ActiveConversationRequest request, RegisteredNamespace namespace, Instant newest,
                             Dispatch dispatch, Throwable error, long elapsedMs) {
        String key = request.conversationKey();
        if (request.token().isCancelled() || active.get(key) != request) {
            log.info("Dropping result of superseded request for {}", key);
            metrics.recordDispatch(dispatch != null ? dispatch.route() : ROUTE_EPHEMERAL, "cancelled", elapsedMs);
            return;
        }
        try {
            if (error == null && dispatch.result().isSuccess()) {
                deliver(key, namespace, newest, dispatch, elapsedMs);
            } else {
                String reason = error != null ? error.getMessage() : dispatch.result().error();
                log.error("Request for {} failed: {}", key, reason);
                metrics.recordDispatch(dispatch != null ? dispatch.route() : ROUTE_EPHEMERAL, "error", elapsedMs);
                actions.publish(new OutboundAction.SendMessage(key,
                        properties.getAssistantName() + ": " + properties.getRouter().getFailureNotice()));
            }
        } catch (RuntimeException e) {
            log.error("Failed to complete request for {}: {}", key, e.getMessage(), e);
        } finally {
            finish(request, namespace, true);
        }
    }

    private void deliver(String key, RegisteredNamespace namespace, Instant newest, Dispatch dispatch,
                         long elapsedMs) {
        WorkerResult result = dispatch.result();
        metrics.recordDispatch(dispatch.route(), "success", elapsedMs);
        if (result.newSessionId() != null) {
            actions.publish(new OutboundAction.UpdateSession(key, namespace.folder(), result.newSessionId()));
        }
        if (result.hasResult()) {
            actions.publish(new OutboundAction.SendMessage(key,
                    properties.getAssistantName() + ": " + result.result()));
        }
        watermarks.advance(key, newest);
        log.info("Request for {} completed via {} in {}ms", key, dispatch.route(), elapsedMs);
    }

    private void finish(ActiveConversationRequest request, RegisteredNamespace namespace, boolean typing) {
        String key = request.conversationKey();
        if (typing) {
            actions.publish(new OutboundAction.TypingStop(key));
        }
        active.remove(key);
        if (!request.followUps().isEmpty()) {
            log.info("Starting queued follow-up batch for {}", key);
            start(key, namespace, request.followUps());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
