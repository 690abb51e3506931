package com.parley.core.mailbox;

import com.parley.core.action.ActionChannel;
import com.parley.core.action.OutboundAction;
import com.parley.core.config.ParleyProperties;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.ContextMode;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.model.ScheduleType;
import com.parley.core.model.ScheduledTask;
import com.parley.core.model.TaskStatus;
import com.parley.core.protocol.RequestIds;
import com.parley.core.router.SubagentLauncher;
import com.parley.core.scheduler.ScheduleCalculator;
import com.parley.core.scheduler.SchedulingSpecException;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Authorizes and applies mailbox commands.
 *
 * <p>A namespace may only address itself; the privileged namespace may address any registered
 * namespace and alone may register namespaces or spawn subagents. Conversation keys are always
 * looked up in the {@link NamespaceRegistry}, never taken from the command. Unauthorized commands
 * are logged and dropped without telling the sender.
 *
 * <p>Runs on the orchestrator loop.
 */
public class MailboxCommandHandler implements Consumer<MailboxEnvelope> {

    private static final Logger log = LoggerFactory.getLogger(MailboxCommandHandler.class);

    private static final Pattern FOLDER_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    static final String APPLIED = "applied";
    static final String UNAUTHORIZED = "unauthorized";
    static final String INVALID = "invalid";
    static final String REJECTED = "rejected";

    private final NamespaceRegistry namespaces;
    private final TaskStore tasks;
    private final ScheduleCalculator calculator;
    private final SubagentLauncher subagents;
    private final SnapshotWriter snapshots;
    private final ActionChannel actions;
    private final ParleyProperties properties;
    private final Clock clock;
    private final ParleyMetrics metrics;

    public MailboxCommandHandler(NamespaceRegistry namespaces, TaskStore tasks, ScheduleCalculator calculator,
                                 SubagentLauncher subagents, SnapshotWriter snapshots, ActionChannel actions,
                                 ParleyProperties properties, Clock clock, ParleyMetrics metrics) {
        this.namespaces = namespaces;
        this.tasks = tasks;
        this.calculator = calculator;
        this.subagents = subagents;
        this.snapshots = snapshots;
        this.actions = actions;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public void accept(MailboxEnvelope envelope) {
        String source = envelope.sourceNamespace();
        MailboxCommand command = envelope.command();
        String outcome;
        if (command instanceof MailboxCommand.Message message) {
            outcome = sendMessage(source, message);
        } else if (command instanceof MailboxCommand.ScheduleTask schedule) {
            outcome = scheduleTask(source, schedule);
        } else if (command instanceof MailboxCommand.PauseTask pause) {
            outcome = changeStatus(source, pause.taskId(), TaskStatus.ACTIVE, TaskStatus.PAUSED);
        } else if (command instanceof MailboxCommand.ResumeTask resume) {
            outcome = changeStatus(source, resume.taskId(), TaskStatus.PAUSED, TaskStatus.ACTIVE);
        } else if (command instanceof MailboxCommand.CancelTask cancel) {
            outcome = cancelTask(source, cancel.taskId());
        } else if (command instanceof MailboxCommand.RegisterNamespace register) {
            outcome = registerNamespace(source, register);
        } else if (command instanceof MailboxCommand.SpawnSubagent spawn) {
            outcome = spawnSubagent(source, spawn);
        } else if (command instanceof MailboxCommand.RefreshSnapshot) {
            snapshots.write(source);
            outcome = APPLIED;
        } else {
            throw new IllegalArgumentException("Unhandled mailbox command " + command.getClass().getSimpleName());
        }
        metrics.recordMailboxCommand(command.type(), outcome);
    }

    private String sendMessage(String source, MailboxCommand.Message message) {
        Optional<RegisteredNamespace> target = namespaces.forConversation(message.conversationKey());
        if (!mayAddress(source, target.map(RegisteredNamespace::folder).orElse(null))) {
            log.warn("Unauthorized message from {} to {} blocked", source, message.conversationKey());
            return UNAUTHORIZED;
        }
        actions.publish(new OutboundAction.SendMessage(message.conversationKey(),
                properties.getAssistantName() + ": " + message.text()));
        log.info("Mailbox message from {} dispatched to {}", source, message.conversationKey());
        return APPLIED;
    }

    private String scheduleTask(String source, MailboxCommand.ScheduleTask command) {
        String targetFolder = command.targetNamespace() != null ? command.targetNamespace() : source;
        if (!namespaces.isPrivileged(source) && !targetFolder.equals(source)) {
            log.warn("Unauthorized schedule_task from {} for {} blocked", source, targetFolder);
            return UNAUTHORIZED;
        }
        Optional<String> conversationKey = namespaces.conversationFor(targetFolder);
        if (conversationKey.isEmpty()) {
            log.warn("Cannot schedule task: namespace {} is not registered", targetFolder);
            return INVALID;
        }

        Instant now = clock.instant();
        ScheduleType type = ScheduleType.parse(command.scheduleType());
        Instant nextRun;
        try {
            nextRun = calculator.firstRun(type, command.scheduleValue(), now);
        } catch (SchedulingSpecException e) {
            log.warn("Rejected schedule from {}: {}", source, e.getMessage());
            notifySource(source, "Could not schedule the task: " + e.getMessage());
            return INVALID;
        }

        String id = RequestIds.next("task", clock);
        var task = new ScheduledTask(id, targetFolder, conversationKey.get(), command.prompt(), type,
                command.scheduleValue(), ContextMode.parse(command.contextMode()), nextRun, null, null,
                TaskStatus.ACTIVE, now);
        tasks.create(task);
        log.info("Task {} created by {} for {} ({} {}), first run {}", id, source, targetFolder,
                type.name().toLowerCase(), command.scheduleValue(), nextRun);
        return APPLIED;
    }

    private String changeStatus(String source, String taskId, TaskStatus from, TaskStatus to) {
        Optional<ScheduledTask> task = ownedTask(source, taskId);
        if (task.isEmpty()) {
            log.warn("Unauthorized or unknown task {} for status change by {}", taskId, source);
            return UNAUTHORIZED;
        }
        if (task.get().status() != from) {
            log.info("Task {} is {}, not {}; leaving it unchanged", taskId, task.get().status(), from);
            return INVALID;
        }
        tasks.update(task.get().withStatus(to));
        log.info("Task {} {} by {}", taskId, to == TaskStatus.PAUSED ? "paused" : "resumed", source);
        return APPLIED;
    }

    private String cancelTask(String source, String taskId) {
        if (ownedTask(source, taskId).isEmpty()) {
            log.warn("Unauthorized or unknown task {} for cancel by {}", taskId, source);
            return UNAUTHORIZED;
        }
        tasks.delete(taskId);
        log.info("Task {} cancelled by {}", taskId, source);
        return APPLIED;
    }

    private String registerNamespace(String source, MailboxCommand.RegisterNamespace command) {
        if (!namespaces.isPrivileged(source)) {
            log.warn("Unauthorized register_namespace from {} blocked", source);
            return UNAUTHORIZED;
        }
        String folder = command.folder();
        if (!FOLDER_PATTERN.matcher(folder).matches() || MailboxPoller.ERRORS_DIR.equals(folder)
                || namespaces.isPrivileged(folder)) {
            log.warn("Rejected register_namespace with folder '{}'", folder);
            return INVALID;
        }
        // fails the command, and so quarantines the file, when the folder cannot be created
        createFolder(folder);
        actions.publish(new OutboundAction.RegisterNamespace(command.conversationKey(), command.name(), folder,
                command.trigger(), command.containerOptions()));
        return APPLIED;
    }

    private void createFolder(String folder) {
        try {
            Files.createDirectories(properties.groupsPath().resolve(folder).resolve("logs"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create folder for namespace " + folder, e);
        }
    }

    private String spawnSubagent(String source, MailboxCommand.SpawnSubagent command) {
        if (!namespaces.isPrivileged(source)) {
            log.warn("Unauthorized spawn_subagent from {} blocked", source);
            return UNAUTHORIZED;
        }
        return switch (subagents.launch(command.task(), command.conversationKey(), command.includeContext())) {
            case STARTED -> APPLIED;
            case REJECTED -> REJECTED;
            case UNKNOWN_TARGET -> INVALID;
        };
    }

    /** The task, if it exists and {@code source} may touch it. */
    private Optional<ScheduledTask> ownedTask(String source, String taskId) {
        return tasks.get(taskId)
                .filter(t -> namespaces.isPrivileged(source) || t.ownerNamespace().equals(source));
    }

    private boolean mayAddress(String source, String targetFolder) {
        if (targetFolder == null) {
            return false;
        }
        return namespaces.isPrivileged(source) || targetFolder.equals(source);
    }

    private void notifySource(String source, String text) {
        namespaces.conversationFor(source).ifPresent(key ->
                actions.publish(new OutboundAction.SendMessage(key, properties.getAssistantName() + ": " + text)));
    }
}
