package com.parley.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.core.action.ActionChannel;
import com.parley.core.action.CoreActionHandler;
import com.parley.core.action.OutboundAction;
import com.parley.core.config.ParleyProperties;
import com.parley.core.lifecycle.PersistentWorkerManager;
import com.parley.core.mailbox.MailboxCodec;
import com.parley.core.mailbox.MailboxCommandHandler;
import com.parley.core.mailbox.MailboxPoller;
import com.parley.core.mailbox.SnapshotWriter;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.protocol.WireCodec;
import com.parley.core.router.PromptRenderer;
import com.parley.core.router.RequestRouter;
import com.parley.core.router.SubagentLauncher;
import com.parley.core.router.SubagentRegistry;
import com.parley.core.scheduler.ScheduleCalculator;
import com.parley.core.scheduler.TaskScheduler;
import com.parley.core.store.FileMessageStore;
import com.parley.core.store.FileTaskStore;
import com.parley.core.store.MessageStore;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.SessionRegistry;
import com.parley.core.store.StateFiles;
import com.parley.core.store.TaskStore;
import com.parley.core.store.WatermarkStore;
import com.parley.testsupport.FakeWorkerProvider.FakeWorker;
import com.parley.worker.EphemeralWorkerPool;
import com.parley.worker.MountPlanner;
import com.parley.worker.WorkerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The core object graph wired the way {@code OrchestratorConfig} wires it, but on a
 * {@link ManualLoop}, a {@link MutableClock} and a {@link FakeWorkerProvider}, with state
 * files under a temporary directory. Every published action is recorded.
 */
public class ParleyHarness {

    public static final String MAIN_KEY = "chat-main";

    public final Path root;
    public final MutableClock clock = new MutableClock(TestFixtures.T0);
    public final ManualLoop loop = new ManualLoop(clock);
    public final FakeWorkerProvider provider = new FakeWorkerProvider();
    public final ObjectMapper objectMapper = TestFixtures.objectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ParleyProperties properties;
    public final WorkerProperties workerProperties = new WorkerProperties();
    public final ParleyMetrics metrics = new ParleyMetrics(meterRegistry);

    public final StateFiles files;
    public final NamespaceRegistry namespaces;
    public final SessionRegistry sessions;
    public final WatermarkStore watermarks;
    public final MessageStore messages;
    public final TaskStore tasks;
    public final ActionChannel actions = new ActionChannel();
    public final List<OutboundAction> published = new CopyOnWriteArrayList<>();

    public final PersistentWorkerManager persistent;
    public final EphemeralWorkerPool pool;
    public final SubagentRegistry subagents;
    public final PromptRenderer renderer = new PromptRenderer();
    public final SnapshotWriter snapshots;
    public final RequestRouter router;
    public final SubagentLauncher launcher;
    public final ScheduleCalculator calculator;
    public final MailboxCommandHandler mailboxHandler;
    public final MailboxPoller mailboxPoller;
    public final TaskScheduler scheduler;

    public ParleyHarness(Path root) {
        this(root, p -> {});
    }

    public ParleyHarness(Path root, Consumer<ParleyProperties> customizer) {
        this.root = root;
        this.properties = TestFixtures.properties(root);
        customizer.accept(properties);

        files = new StateFiles(objectMapper, properties.dataPath());
        namespaces = new NamespaceRegistry(files, properties.getPrivileged().getFolder());
        sessions = new SessionRegistry(files);
        watermarks = new WatermarkStore(files);
        messages = new FileMessageStore(files);
        tasks = new FileTaskStore(files);

        var coreHandler = new CoreActionHandler(namespaces, sessions, messages, properties, clock);
        actions.subscribe(published::add);
        actions.subscribe(coreHandler::handle);

        var codec = new WireCodec(objectMapper);
        var planner = new MountPlanner(properties, workerProperties, root.resolve("project"));
        pool = new EphemeralWorkerPool(provider, planner, codec, workerProperties, loop, Runnable::run, clock, metrics);
        persistent = new PersistentWorkerManager(provider, planner, codec, properties.getPersistent(), loop,
                Runnable::run, clock, metrics);
        subagents = new SubagentRegistry(properties.getSubagent().getMaxConcurrent());
        snapshots = new SnapshotWriter(files, tasks, namespaces, clock);
        router = new RequestRouter(properties, namespaces, sessions, messages, watermarks, persistent, pool,
                subagents, renderer, snapshots, actions, loop, clock, metrics);
        launcher = new SubagentLauncher(subagents, pool, namespaces, sessions, messages, renderer, actions,
                properties, clock, metrics);
        calculator = new ScheduleCalculator(properties.zoneId());
        mailboxHandler = new MailboxCommandHandler(namespaces, tasks, calculator, launcher, snapshots, actions,
                properties, clock, metrics);
        mailboxPoller = new MailboxPoller(properties.mailboxRoot(), new MailboxCodec(objectMapper), mailboxHandler,
                loop, properties.getMailbox().getPollInterval(), metrics);
        scheduler = new TaskScheduler(tasks, namespaces, sessions, router, calculator, loop,
                properties.getScheduler().getPollInterval(), clock, metrics);
    }

    /** Registers the privileged namespace under {@link #MAIN_KEY}. */
    public RegisteredNamespace registerMain() {
        return register(MAIN_KEY, properties.getPrivileged().getFolder());
    }

    public RegisteredNamespace register(String conversationKey, String folder) {
        var namespace = new RegisteredNamespace(folder, folder, "@" + properties.getAssistantName(),
                clock.instant(), null);
        namespaces.register(conversationKey, namespace);
        return namespace;
    }

    public <T extends OutboundAction> List<T> published(Class<T> type) {
        return published.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /** Texts of {@link OutboundAction.SendMessage}s to {@code conversationKey}, in order. */
    public List<String> sentTo(String conversationKey) {
        return published(OutboundAction.SendMessage.class).stream()
                .filter(m -> m.conversationKey().equals(conversationKey))
                .map(OutboundAction.SendMessage::text)
                .toList();
    }

    public List<FakeWorker> ephemeralWorkers() {
        return provider.workers().stream().filter(w -> !w.spec().persistent()).toList();
    }

    public List<FakeWorker> persistentWorkers() {
        return provider.workers().stream().filter(w -> w.spec().persistent()).toList();
    }

    public FakeWorker lastEphemeral() {
        var workers = ephemeralWorkers();
        if (workers.isEmpty()) {
            throw new IllegalStateException("No one-shot worker has been spawned");
        }
        return workers.get(workers.size() - 1);
    }
}
