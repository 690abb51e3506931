package com.parley.core.model;

import java.time.Instant;

/**
 * A conversation owner known to the orchestrator.
 *
 * @param name             display name
 * @param folder           namespace id; names the working, session and mailbox directories
 * @param trigger          trigger word recorded at registration
 * @param addedAt          registration time
 * @param containerOptions optional worker overrides, may be null
 */
public record RegisteredNamespace(
    String name,
    String folder,
    String trigger,
    Instant addedAt,
    ContainerOptions containerOptions
) {}
