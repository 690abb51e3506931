package com.parley.worker;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to start one worker container.
 *
 * @param name          unique worker name, also used for the container name
 * @param image         container image
 * @param mounts        namespace mount contract from {@link MountPlanner}
 * @param env           environment variables to inject
 * @param persistent    true for the long-lived privileged worker (line protocol, stdin kept open)
 * @param memoryLimitMb memory limit in MB
 * @param cpuCount      CPU count limit
 * @param user          "uid:gid" to run as, empty for the image default
 */
public record WorkerSpec(
    String name,
    String image,
    List<VolumeMount> mounts,
    Map<String, String> env,
    boolean persistent,
    int memoryLimitMb,
    int cpuCount,
    String user
) {
    public WorkerSpec {
        mounts = List.copyOf(mounts);
        env = Map.copyOf(env);
    }
}
