package com.parley.core.router;

import com.parley.core.concurrent.CancellationToken;

public record SubagentHandle(
    String id,
    String ownerConversationKey,
    CancellationToken token
) {}
