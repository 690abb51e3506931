package com.parley.core.mailbox;

import java.nio.file.Path;

/**
 * A decoded mailbox file.
 *
 * @param sourceNamespace folder the file was found under; the only trusted notion of who sent it
 * @param command         the decoded command
 * @param file            where it was read from
 */
public record MailboxEnvelope(
    String sourceNamespace,
    MailboxCommand command,
    Path file
) {}
