package com.parley.core.router;

import com.parley.core.action.ActionChannel;
import com.parley.core.action.OutboundAction;
import com.parley.core.config.ParleyProperties;
import com.parley.core.logging.MdcContext;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.protocol.RequestIds;
import com.parley.core.store.MessageStore;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.SessionRegistry;
import com.parley.worker.EphemeralWorkerPool;
import com.parley.worker.WorkerInvocation;
import com.parley.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Starts subagents on behalf of the privileged worker, subject to the concurrency limit.
 * Loop thread only.
 */
public class SubagentLauncher {

    private static final Logger log = LoggerFactory.getLogger(SubagentLauncher.class);

    private static final int TASK_SUMMARY_LENGTH = 200;

    private final SubagentRegistry subagents;
    private final EphemeralWorkerPool pool;
    private final NamespaceRegistry namespaces;
    private final SessionRegistry sessions;
    private final MessageStore messages;
    private final PromptRenderer renderer;
    private final ActionChannel actions;
    private final ParleyProperties properties;
    private final Clock clock;
    private final ParleyMetrics metrics;

    public SubagentLauncher(SubagentRegistry subagents, EphemeralWorkerPool pool, NamespaceRegistry namespaces,
                            SessionRegistry sessions, MessageStore messages, PromptRenderer renderer,
                            ActionChannel actions, ParleyProperties properties, Clock clock, ParleyMetrics metrics) {
        this.subagents = subagents;
        this.pool = pool;
        this.namespaces = namespaces;
        this.sessions = sessions;
        this.messages = messages;
        this.renderer = renderer;
        this.actions = actions;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    public enum Outcome { STARTED, REJECTED, UNKNOWN_TARGET }

    /**
     * Starts a subagent for {@code conversationKey}, or rejects it immediately with a
     * user-visible notice when the limit is reached. No worker is spawned on rejection.
     */
    public Outcome launch(String task, String conversationKey, boolean includeContext) {
        RegisteredNamespace target = namespaces.forConversation(conversationKey).orElse(null);
        if (target == null) {
            log.warn("Cannot spawn subagent: {} is not registered", conversationKey);
            return Outcome.UNKNOWN_TARGET;
        }
        String id = RequestIds.next("sub", clock, 4);
        var admitted = subagents.tryAdmit(id, conversationKey);
        if (admitted.isEmpty()) {
            log.warn("Subagent limit reached ({}/{}), rejecting request for {}",
                    subagents.size(), subagents.limit(), conversationKey);
            metrics.recordSubagentAdmission(false);
            actions.publish(new OutboundAction.SendMessage(conversationKey, properties.getAssistantName()
                    + ": " + subagents.size() + " subtasks are already running, please try again later."));
            return Outcome.REJECTED;
        }
        SubagentHandle handle = admitted.get();
        metrics.recordSubagentAdmission(true);
        metrics.setActiveSubagents(subagents.size());

        String summary = task.length() <= TASK_SUMMARY_LENGTH ? task : task.substring(0, TASK_SUMMARY_LENGTH);
        String folder = target.folder();

        MdcContext.setSubagent(id, conversationKey);
        log.info("Spawning subagent {} ({} of {} slots in use)", id, subagents.size(), subagents.limit());
        MdcContext.clear();

        actions.publish(new OutboundAction.TypingStart(conversationKey));
        CompletableFuture<WorkerResult> run;
        try {
            String prompt = task;
            if (includeContext) {
                var subagentConfig = properties.getSubagent();
                var recent = messages.recent(conversationKey,
                        clock.instant().minus(subagentConfig.getContextWindow()), subagentConfig.getContextMessages());
                prompt = renderer.withRecentContext(recent, task);
            }
            var invocation = new WorkerInvocation(target, conversationKey, prompt, sessions.get(folder),
                    namespaces.isPrivileged(folder), false, "sub");
            run = pool.run(invocation, handle.token());
        } catch (RuntimeException e) {
            // the admission slot is released on the failure path below
            run = CompletableFuture.failedFuture(e);
        }
        run.whenComplete((result, error) -> {
            subagents.release(id);
            metrics.setActiveSubagents(subagents.size());
            MdcContext.setSubagent(id, conversationKey);
            try {
                if (handle.token().isCancelled()) {
                    log.info("Subagent {} was cancelled, discarding its result", id);
                    return;
                }
                if (result != null && result.newSessionId() != null) {
                    actions.publish(new OutboundAction.UpdateSession(conversationKey, folder, result.newSessionId()));
                }
                if (error == null && result.isSuccess()) {
                    log.info("Subagent {} completed", id);
                    if (result.hasResult()) {
                        actions.publish(new OutboundAction.SubagentResult(conversationKey, result.result(), summary));
                    }
                } else {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    if (cause instanceof CancellationException) {
                        return;
                    }
                    log.error("Subagent {} failed: {}", id, cause != null ? cause.getMessage() : result.error());
                    actions.publish(new OutboundAction.SubagentResult(conversationKey,
                            "The subtask could not be completed.", summary));
                }
            } finally {
                actions.publish(new OutboundAction.TypingStop(conversationKey));
                MdcContext.clear();
            }
        });
        return Outcome.STARTED;
    }
}
