package com.parley.core.health;

import com.github.dockerjava.api.DockerClient;
import com.parley.core.config.ParleyProperties;
import com.parley.core.lifecycle.PersistentWorkerManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final PersistentWorkerManager persistentWorker;
    private final DockerClient dockerClient;
    private final ParleyProperties properties;

    public HealthCheckService(
            @Autowired(required = false) PersistentWorkerManager persistentWorker,
            @Autowired(required = false) DockerClient dockerClient,
            ParleyProperties properties) {
        this.persistentWorker = persistentWorker;
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPersistentWorker());
        results.add(checkDocker());
        results.add(checkMailbox());
        return results;
    }

    HealthStatus checkPersistentWorker() {
        if (!properties.getPersistent().isEnabled()) {
            return new HealthStatus("persistent-worker", HealthStatus.Status.UP,
                    "Disabled; privileged namespace uses one-shot workers", Map.of());
        }
        if (persistentWorker == null) {
            return new HealthStatus("persistent-worker", HealthStatus.Status.DOWN,
                    "Persistent worker manager not configured", Map.of());
        }
        var state = persistentWorker.state();
        var metadata = Map.of("state", state.name(),
                "restartAttempts", String.valueOf(persistentWorker.restartAttempts()),
                "fallbackOnly", String.valueOf(persistentWorker.isFallbackOnly()));
        return switch (state) {
            case RUNNING -> new HealthStatus("persistent-worker", HealthStatus.Status.UP,
                    "Persistent worker running", metadata);
            case STARTING, RESTARTING -> new HealthStatus("persistent-worker", HealthStatus.Status.DEGRADED,
                    "Persistent worker " + state.name().toLowerCase(), metadata);
            case FATAL -> new HealthStatus("persistent-worker", HealthStatus.Status.DEGRADED,
                    "Restart budget exhausted; using one-shot workers", metadata);
            case STOPPED, SHUTTING_DOWN -> new HealthStatus("persistent-worker", HealthStatus.Status.DOWN,
                    "Persistent worker " + state.name().toLowerCase(), metadata);
        };
    }

    HealthStatus checkDocker() {
        if (dockerClient == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No Docker client configured", Map.of());
        }
        try {
            dockerClient.pingCmd().exec();
            return new HealthStatus("docker", HealthStatus.Status.UP, "Docker daemon reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkMailbox() {
        Path root = properties.mailboxRoot();
        try {
            Files.createDirectories(root);
            Path marker = Files.createTempFile(root, ".health", ".tmp");
            Files.delete(marker);
            return new HealthStatus("mailbox", HealthStatus.Status.UP, "Mailbox root writable",
                    Map.of("path", root.toString()));
        } catch (IOException e) {
            log.warn("Mailbox health check failed: {}", e.getMessage());
            return new HealthStatus("mailbox", HealthStatus.Status.DOWN,
                    "Mailbox root not writable: " + e.getMessage(), Map.of("path", root.toString()));
        }
    }
}
