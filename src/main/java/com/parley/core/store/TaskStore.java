package com.parley.core.store;

import com.parley.core.model.ScheduledTask;
import com.parley.core.model.TaskRunLog;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TaskStore {

    void create(ScheduledTask task);

    Optional<ScheduledTask> get(String id);

    /** Replaces an existing task; returns false when it no longer exists. */
    boolean update(ScheduledTask task);

    boolean delete(String id);

    List<ScheduledTask> all();

    default List<ScheduledTask> ownedBy(String namespace) {
        return all().stream().filter(t -> t.ownerNamespace().equals(namespace)).toList();
    }

    default List<ScheduledTask> due(Instant now) {
        return all().stream().filter(t -> t.isDue(now)).toList();
    }

    void logRun(TaskRunLog run);

    List<TaskRunLog> runs(String taskId);
}
