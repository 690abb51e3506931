package com.parley.core.mailbox;

import com.parley.core.concurrent.LoopTask;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.protocol.ProtocolParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Polls {@code <mailboxRoot>/<namespace>/{messages,tasks}/*.json} and hands each command to the handler.
 *
 * <p>A file is deleted once handled. A file that cannot be parsed or handled is moved to
 * {@code <mailboxRoot>/errors/<namespace>-<file>} so it is never retried.
 */
public class MailboxPoller {

    private static final Logger log = LoggerFactory.getLogger(MailboxPoller.class);

    static final String ERRORS_DIR = "errors";
    static final String MESSAGES_DIR = "messages";
    static final String TASKS_DIR = "tasks";

    private final Path root;
    private final MailboxCodec codec;
    private final Consumer<MailboxEnvelope> handler;
    private final OrchestratorLoop loop;
    private final Duration interval;
    private final ParleyMetrics metrics;

    private LoopTask ticker;

    public MailboxPoller(Path root, MailboxCodec codec, Consumer<MailboxEnvelope> handler,
                         OrchestratorLoop loop, Duration interval, ParleyMetrics metrics) {
        this.root = root;
        this.codec = codec;
        this.handler = handler;
        this.loop = loop;
        this.interval = interval;
        this.metrics = metrics;
    }

    public void start() {
        if (ticker != null) {
            log.debug("Mailbox poller already running");
            return;
        }
        ticker = loop.scheduleAtFixedRate(Duration.ZERO, interval, this::poll);
        log.info("Mailbox poller started on {} every {}ms", root, interval.toMillis());
    }

    public void stop() {
        if (ticker != null) {
            ticker.cancel();
            ticker = null;
            log.info("Mailbox poller stopped");
        }
    }

    /** One scan over every namespace directory. Runs on the loop. */
    public void poll() {
        for (Path namespaceDir : list(root, Files::isDirectory)) {
            String source = namespaceDir.getFileName().toString();
            if (ERRORS_DIR.equals(source)) continue;
            drain(source, namespaceDir.resolve(MESSAGES_DIR), true);
            drain(source, namespaceDir.resolve(TASKS_DIR), false);
        }
    }

    private void drain(String source, Path dir, boolean messageQueue) {
        for (Path file : list(dir, p -> p.getFileName().toString().endsWith(".json") && Files.isRegularFile(p))) {
            try {
                MailboxCommand command = codec.decode(Files.readString(file, StandardCharsets.UTF_8));
                boolean isMessage = command instanceof MailboxCommand.Message;
                if (isMessage != messageQueue) {
                    throw new ProtocolParseException("Command '" + command.type() + "' not accepted in "
                            + dir.getFileName() + "/");
                }
                handler.accept(new MailboxEnvelope(source, command, file));
                Files.deleteIfExists(file);
            } catch (Exception e) {
                log.error("Failed to process mailbox file {} from {}: {}", file.getFileName(), source, e.getMessage());
                quarantine(source, file);
            }
        }
    }

    private void quarantine(String source, Path file) {
        Path errors = root.resolve(ERRORS_DIR);
        try {
            Files.createDirectories(errors);
            Files.move(file, errors.resolve(source + "-" + file.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            metrics.recordQuarantine(source);
        } catch (IOException e) {
            log.error("Could not quarantine {}, deleting it instead", file, e);
            try {
                Files.deleteIfExists(file);
            } catch (IOException deleteFailure) {
                log.error("Could not delete poison mailbox file {}", file, deleteFailure);
            }
        }
    }

    private static List<Path> list(Path dir, Predicate<Path> filter) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (var stream = Files.list(dir)) {
            return stream.filter(filter).sorted().toList();
        } catch (IOException e) {
            log.error("Error reading mailbox directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }
}
