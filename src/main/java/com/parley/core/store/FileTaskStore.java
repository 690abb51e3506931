package com.parley.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.parley.core.model.ScheduledTask;
import com.parley.core.model.TaskRunLog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tasks in {@code tasks.json}, run history appended to {@code task_runs.jsonl}.
 */
public class FileTaskStore implements TaskStore {

    static final String TASKS_FILE = "tasks.json";
    static final String RUNS_FILE = "task_runs.jsonl";

    private final StateFiles files;
    private final Map<String, ScheduledTask> tasks = new LinkedHashMap<>();

    public FileTaskStore(StateFiles files) {
        this.files = files;
        for (ScheduledTask task : files.read(TASKS_FILE, new TypeReference<List<ScheduledTask>>() {}, List::of)) {
            tasks.put(task.id(), task);
        }
    }

    @Override
    public synchronized void create(ScheduledTask task) {
        if (tasks.containsKey(task.id())) {
            throw new IllegalArgumentException("Task " + task.id() + " already exists");
        }
        tasks.put(task.id(), task);
        flush();
    }

    @Override
    public synchronized Optional<ScheduledTask> get(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public synchronized boolean update(ScheduledTask task) {
        if (!tasks.containsKey(task.id())) {
            return false;
        }
        tasks.put(task.id(), task);
        flush();
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        if (tasks.remove(id) == null) {
            return false;
        }
        flush();
        return true;
    }

    @Override
    public synchronized List<ScheduledTask> all() {
        return new ArrayList<>(tasks.values());
    }

    @Override
    public synchronized void logRun(TaskRunLog run) {
        files.append(RUNS_FILE, run);
    }

    @Override
    public synchronized List<TaskRunLog> runs(String taskId) {
        return files.readLines(RUNS_FILE, TaskRunLog.class).stream()
                .filter(r -> r.taskId().equals(taskId))
                .sorted(Comparator.comparing(TaskRunLog::runAt).reversed())
                .toList();
    }

    private void flush() {
        files.write(TASKS_FILE, new ArrayList<>(tasks.values()));
    }
}
