package com.parley.dispatch.cli;

import com.parley.core.model.ScheduledTask;
import com.parley.core.store.TaskStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: parley tasks
 * <p>
 * Lists scheduled tasks as a table: Task ID | Namespace | Status | Schedule | Next run | Prompt.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List scheduled tasks")
@Component
public class TasksCommand implements Runnable {

    @Option(names = {"--namespace", "-n"}, description = "Only tasks owned by this namespace folder")
    private String namespace;

    private final TaskStore taskStore;

    public TasksCommand(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ScheduledTask> tasks = namespace == null ? taskStore.all() : taskStore.ownedBy(namespace);
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No scheduled tasks.");
            return;
        }

        ConsoleOutput.info("Scheduled tasks (" + tasks.size() + "):");
        System.out.println();
        System.out.printf("  %-28s %-12s %-10s %-22s %-22s %s%n",
                "TASK ID", "NAMESPACE", "STATUS", "SCHEDULE", "NEXT RUN", "PROMPT");
        System.out.println("  " + "-".repeat(120));
        for (ScheduledTask task : tasks) {
            System.out.printf("  %-28s %-12s %-10s %-22s %-22s %s%n",
                    task.id(),
                    task.ownerNamespace(),
                    task.status().name(),
                    truncate(task.scheduleType().name().toLowerCase() + " " + task.scheduleValue(), 22),
                    task.nextRun() != null ? task.nextRun().toString() : "-",
                    truncate(task.prompt(), 40));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
