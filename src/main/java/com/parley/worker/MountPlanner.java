package com.parley.worker;

import com.parley.core.config.ParleyProperties;
import com.parley.core.model.RegisteredNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the mount and environment contract for a namespace's worker.
 *
 * <p>Every worker sees only its own working directory, session directory and mailbox.
 * The privileged namespace additionally gets the project root. Other namespaces get the
 * shared {@code global} folder read-only when it exists.
 */
public class MountPlanner {

    private static final Logger log = LoggerFactory.getLogger(MountPlanner.class);

    static final String PROJECT_PATH = "/workspace/project";
    static final String GROUP_PATH = "/workspace/group";
    static final String GLOBAL_PATH = "/workspace/global";
    static final String SESSION_PATH = "/home/agent/.claude";
    static final String IPC_PATH = "/workspace/ipc";
    static final String ENV_PATH = "/workspace/env-dir";
    static final String GLOBAL_FOLDER = "global";

    private final ParleyProperties properties;
    private final WorkerProperties workerProperties;
    private final Path projectRoot;
    private final Map<String, String> hostEnv;

    public MountPlanner(ParleyProperties properties, WorkerProperties workerProperties, Path projectRoot) {
        this(properties, workerProperties, projectRoot, System.getenv());
    }

    MountPlanner(ParleyProperties properties, WorkerProperties workerProperties,
                 Path projectRoot, Map<String, String> hostEnv) {
        this.properties = properties;
        this.workerProperties = workerProperties;
        this.projectRoot = projectRoot.toAbsolutePath();
        this.hostEnv = hostEnv;
    }

    public List<VolumeMount> plan(RegisteredNamespace namespace, boolean privileged) {
        String folder = namespace.folder();
        var mounts = new ArrayList<VolumeMount>();

        Path groupDir = ensureDir(properties.groupsPath().resolve(folder));
        if (privileged) {
            mounts.add(new VolumeMount(projectRoot.toString(), PROJECT_PATH, false));
            mounts.add(new VolumeMount(groupDir.toString(), GROUP_PATH, false));
        } else {
            mounts.add(new VolumeMount(groupDir.toString(), GROUP_PATH, false));
            Path globalDir = properties.groupsPath().resolve(GLOBAL_FOLDER);
            if (Files.isDirectory(globalDir)) {
                mounts.add(new VolumeMount(globalDir.toString(), GLOBAL_PATH, true));
            }
        }

        Path sessionDir = ensureDir(properties.dataPath().resolve("sessions").resolve(folder).resolve(".claude"));
        mounts.add(new VolumeMount(sessionDir.toString(), SESSION_PATH, false));

        Path ipcDir = properties.mailboxRoot().resolve(folder);
        ensureDir(ipcDir.resolve("messages"));
        ensureDir(ipcDir.resolve("tasks"));
        mounts.add(new VolumeMount(ipcDir.toString(), IPC_PATH, false));

        Path envDir = writeFilteredEnv();
        if (envDir != null) {
            mounts.add(new VolumeMount(envDir.toString(), ENV_PATH, true));
        }
        return mounts;
    }

    /**
     * Full container spec for a namespace worker.
     */
    public WorkerSpec specFor(RegisteredNamespace namespace, boolean privileged, String workerName, boolean persistent) {
        var env = new HashMap<String, String>();
        for (String key : workerProperties.getForwardedEnv()) {
            String value = hostEnv.get(key);
            if (value != null && !value.isBlank()) {
                env.put(key, value);
            }
        }
        if (namespace.containerOptions() != null) {
            env.putAll(namespace.containerOptions().env());
        }
        env.put("PARLEY_NAMESPACE", namespace.folder());
        env.put("PARLEY_PRIVILEGED", String.valueOf(privileged));
        if (persistent) {
            env.put("PARLEY_PERSISTENT", "true");
        }
        return new WorkerSpec(workerName, workerProperties.getImage(), plan(namespace, privileged), env,
                persistent, workerProperties.getMemoryLimitMb(), workerProperties.getCpuCount(),
                workerProperties.getUser());
    }

    /**
     * Copies only the forwarded keys of the project's {@code .env} into a file the worker can read.
     * Returns the directory holding it, or null when there is no {@code .env}.
     */
    private Path writeFilteredEnv() {
        Path envFile = projectRoot.resolve(".env");
        if (!Files.isRegularFile(envFile)) {
            return null;
        }
        try {
            var allowed = workerProperties.getForwardedEnv();
            var kept = Files.readAllLines(envFile).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .filter(line -> {
                        int eq = line.indexOf('=');
                        return eq > 0 && allowed.contains(line.substring(0, eq).trim());
                    })
                    .toList();
            if (kept.isEmpty()) {
                return null;
            }
            Path envDir = ensureDir(properties.dataPath().resolve("env"));
            Files.write(envDir.resolve("env"), kept);
            return envDir;
        } catch (IOException e) {
            log.warn("Could not prepare worker env file from {}: {}", envFile, e.getMessage());
            return null;
        }
    }

    private static Path ensureDir(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + dir, e);
        }
    }
}
