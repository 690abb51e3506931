package com.parley.dispatch.api;

import com.parley.core.model.ScheduledTask;
import com.parley.core.model.TaskRunLog;
import com.parley.core.store.TaskStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of scheduled tasks and their run history.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskStore taskStore;

    public TaskController(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    @GetMapping
    public List<ScheduledTask> list(@RequestParam(name = "namespace", required = false) String namespace) {
        return namespace == null ? taskStore.all() : taskStore.ownedBy(namespace);
    }

    /**
     * GET /api/v1/tasks/{id}/runs: run history, newest first. 404 for an unknown task.
     */
    @GetMapping("/{id}/runs")
    public ResponseEntity<List<TaskRunLog>> runs(@PathVariable("id") String id) {
        if (taskStore.get(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(taskStore.runs(id));
    }
}
