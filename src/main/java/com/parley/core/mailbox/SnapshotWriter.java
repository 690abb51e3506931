package com.parley.core.mailbox;

import com.parley.core.model.ScheduledTask;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.StateFiles;
import com.parley.core.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Writes read-only views of orchestrator state into a namespace's mailbox directory
 * so its worker can see which tasks it owns and, for the privileged namespace, which
 * namespaces exist.
 */
public class SnapshotWriter {

    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    static final String TASKS_FILE = "current_tasks.json";
    static final String NAMESPACES_FILE = "available_namespaces.json";

    private final StateFiles files;
    private final TaskStore tasks;
    private final NamespaceRegistry namespaces;
    private final Clock clock;

    public record TaskView(String id, String namespace, String prompt, String scheduleType,
                           String scheduleValue, String status, Instant nextRun) {}

    public record NamespaceView(String conversationKey, String name, String folder, String trigger) {}

    public record NamespacesView(List<NamespaceView> namespaces, Instant lastSync) {}

    public SnapshotWriter(StateFiles files, TaskStore tasks, NamespaceRegistry namespaces, Clock clock) {
        this.files = files;
        this.tasks = tasks;
        this.namespaces = namespaces;
        this.clock = clock;
    }

    public void write(String folder) {
        boolean privileged = namespaces.isPrivileged(folder);
        List<ScheduledTask> visible = privileged ? tasks.all() : tasks.ownedBy(folder);
        var taskViews = visible.stream()
                .map(t -> new TaskView(t.id(), t.ownerNamespace(), t.prompt(),
                        t.scheduleType().name().toLowerCase(), t.scheduleValue(),
                        t.status().name().toLowerCase(), t.nextRun()))
                .toList();
        try {
            files.write(path(folder, TASKS_FILE), taskViews);
            if (privileged) {
                var nsViews = namespaces.all().entrySet().stream()
                        .map(e -> new NamespaceView(e.getKey(), e.getValue().name(), e.getValue().folder(),
                                e.getValue().trigger()))
                        .sorted(Comparator.comparing(NamespaceView::folder))
                        .toList();
                files.write(path(folder, NAMESPACES_FILE), new NamespacesView(nsViews, clock.instant()));
            }
        } catch (UncheckedIOException e) {
            log.warn("Could not write snapshot for {}: {}", folder, e.getMessage());
        }
    }

    private static String path(String folder, String file) {
        return "ipc/" + folder + "/" + file;
    }
}
