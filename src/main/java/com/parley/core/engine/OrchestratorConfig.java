package com.parley.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.core.action.ActionChannel;
import com.parley.core.action.CoreActionHandler;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.config.ParleyProperties;
import com.parley.core.lifecycle.PersistentWorkerManager;
import com.parley.core.mailbox.MailboxCodec;
import com.parley.core.mailbox.MailboxCommandHandler;
import com.parley.core.mailbox.MailboxPoller;
import com.parley.core.mailbox.SnapshotWriter;
import com.parley.core.metrics.ParleyMetrics;
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
import com.parley.worker.EphemeralWorkerPool;
import com.parley.worker.MountPlanner;
import com.parley.worker.WorkerProperties;
import com.parley.worker.WorkerProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Wires the control plane. Everything is constructed once here and handed its collaborators;
 * nothing runs until {@link Orchestrator#start()}.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OrchestratorLoop orchestratorLoop() {
        return new OrchestratorLoop();
    }

    @Bean
    public StateFiles stateFiles(ObjectMapper objectMapper, ParleyProperties properties) {
        return new StateFiles(objectMapper, properties.dataPath());
    }

    @Bean
    public NamespaceRegistry namespaceRegistry(StateFiles files, ParleyProperties properties) {
        return new NamespaceRegistry(files, properties.getPrivileged().getFolder());
    }

    @Bean
    public SessionRegistry sessionRegistry(StateFiles files) {
        return new SessionRegistry(files);
    }

    @Bean
    public WatermarkStore watermarkStore(StateFiles files) {
        return new WatermarkStore(files);
    }

    @Bean
    public MessageStore messageStore(StateFiles files) {
        return new FileMessageStore(files);
    }

    @Bean
    public TaskStore taskStore(StateFiles files) {
        return new FileTaskStore(files);
    }

    @Bean
    public ActionChannel actionChannel() {
        return new ActionChannel();
    }

    @Bean
    public CoreActionHandler coreActionHandler(ActionChannel channel, NamespaceRegistry namespaces,
                                               SessionRegistry sessions, MessageStore messages,
                                               ParleyProperties properties, Clock clock) {
        var handler = new CoreActionHandler(namespaces, sessions, messages, properties, clock);
        channel.subscribe(handler::handle);
        return handler;
    }

    @Bean
    public WireCodec wireCodec(ObjectMapper objectMapper) {
        return new WireCodec(objectMapper);
    }

    @Bean
    public MountPlanner mountPlanner(ParleyProperties properties, WorkerProperties workerProperties) {
        return new MountPlanner(properties, workerProperties, Path.of("").toAbsolutePath());
    }

    @Bean
    public EphemeralWorkerPool ephemeralWorkerPool(WorkerProvider provider, MountPlanner mountPlanner,
                                                   WireCodec codec, WorkerProperties workerProperties,
                                                   OrchestratorLoop loop,
                                                   @Qualifier("workerIoExecutor") ExecutorService ioExecutor,
                                                   Clock clock, ParleyMetrics metrics) {
        return new EphemeralWorkerPool(provider, mountPlanner, codec, workerProperties, loop, ioExecutor, clock, metrics);
    }

    @Bean
    public PersistentWorkerManager persistentWorkerManager(WorkerProvider provider, MountPlanner mountPlanner,
                                                           WireCodec codec, ParleyProperties properties,
                                                           OrchestratorLoop loop,
                                                           @Qualifier("workerIoExecutor") ExecutorService ioExecutor,
                                                           Clock clock, ParleyMetrics metrics) {
        return new PersistentWorkerManager(provider, mountPlanner, codec, properties.getPersistent(), loop,
                ioExecutor, clock, metrics);
    }

    @Bean
    public SubagentRegistry subagentRegistry(ParleyProperties properties) {
        return new SubagentRegistry(properties.getSubagent().getMaxConcurrent());
    }

    @Bean
    public PromptRenderer promptRenderer() {
        return new PromptRenderer();
    }

    @Bean
    public SnapshotWriter snapshotWriter(StateFiles files, TaskStore tasks, NamespaceRegistry namespaces, Clock clock) {
        return new SnapshotWriter(files, tasks, namespaces, clock);
    }

    @Bean
    public ScheduleCalculator scheduleCalculator(ParleyProperties properties) {
        return new ScheduleCalculator(properties.zoneId());
    }

    @Bean
    public RequestRouter requestRouter(ParleyProperties properties, NamespaceRegistry namespaces,
                                       SessionRegistry sessions, MessageStore messages, WatermarkStore watermarks,
                                       PersistentWorkerManager persistent, EphemeralWorkerPool ephemeral,
                                       SubagentRegistry subagents, PromptRenderer renderer, SnapshotWriter snapshots,
                                       ActionChannel actions, OrchestratorLoop loop, Clock clock,
                                       ParleyMetrics metrics) {
        return new RequestRouter(properties, namespaces, sessions, messages, watermarks, persistent, ephemeral,
                subagents, renderer, snapshots, actions, loop, clock, metrics);
    }

    @Bean
    public SubagentLauncher subagentLauncher(SubagentRegistry subagents, EphemeralWorkerPool pool,
                                             NamespaceRegistry namespaces, SessionRegistry sessions,
                                             MessageStore messages, PromptRenderer renderer, ActionChannel actions,
                                             ParleyProperties properties, Clock clock, ParleyMetrics metrics) {
        return new SubagentLauncher(subagents, pool, namespaces, sessions, messages, renderer, actions,
                properties, clock, metrics);
    }

    @Bean
    public MailboxCommandHandler mailboxCommandHandler(NamespaceRegistry namespaces, TaskStore tasks,
                                                       ScheduleCalculator calculator, SubagentLauncher subagents,
                                                       SnapshotWriter snapshots, ActionChannel actions,
                                                       ParleyProperties properties, Clock clock,
                                                       ParleyMetrics metrics) {
        return new MailboxCommandHandler(namespaces, tasks, calculator, subagents, snapshots, actions,
                properties, clock, metrics);
    }

    @Bean
    public MailboxPoller mailboxPoller(ParleyProperties properties, ObjectMapper objectMapper,
                                       MailboxCommandHandler handler, OrchestratorLoop loop, ParleyMetrics metrics) {
        return new MailboxPoller(properties.mailboxRoot(), new MailboxCodec(objectMapper), handler, loop,
                properties.getMailbox().getPollInterval(), metrics);
    }

    @Bean
    public TaskScheduler taskScheduler(TaskStore tasks, NamespaceRegistry namespaces, SessionRegistry sessions,
                                       RequestRouter router, ScheduleCalculator calculator, OrchestratorLoop loop,
                                       ParleyProperties properties, Clock clock, ParleyMetrics metrics) {
        return new TaskScheduler(tasks, namespaces, sessions, router, calculator, loop,
                properties.getScheduler().getPollInterval(), clock, metrics);
    }

    @Bean
    public Orchestrator orchestrator(ParleyProperties properties, OrchestratorLoop loop, NamespaceRegistry namespaces,
                                     RequestRouter router, PersistentWorkerManager persistentWorker,
                                     MailboxPoller mailboxPoller, TaskScheduler scheduler, ActionChannel actions,
                                     CoreActionHandler coreActionHandler) {
        return new Orchestrator(properties, loop, namespaces, router, persistentWorker, mailboxPoller, scheduler,
                actions);
    }
}
