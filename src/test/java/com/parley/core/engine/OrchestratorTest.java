package com.parley.core.engine;

import com.parley.core.action.ActionChannel;
import com.parley.core.action.OutboundAction;
import com.parley.core.config.ParleyProperties;
import com.parley.core.lifecycle.PersistentWorkerManager;
import com.parley.core.mailbox.MailboxPoller;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.router.RequestRouter;
import com.parley.core.scheduler.TaskScheduler;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.StateFiles;
import com.parley.testsupport.ManualLoop;
import com.parley.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OrchestratorTest {

    @TempDir
    Path tmp;

    private ParleyProperties properties;
    private NamespaceRegistry namespaces;
    private RequestRouter router;
    private PersistentWorkerManager persistentWorker;
    private MailboxPoller mailboxPoller;
    private TaskScheduler scheduler;
    private ActionChannel actions;
    private List<OutboundAction> published;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new ParleyProperties();
        properties.setDataDir(tmp.toString());
        namespaces = new NamespaceRegistry(new StateFiles(TestFixtures.objectMapper(), tmp), "main");
        router = mock(RequestRouter.class);
        persistentWorker = mock(PersistentWorkerManager.class);
        mailboxPoller = mock(MailboxPoller.class);
        scheduler = mock(TaskScheduler.class);
        actions = new ActionChannel();
        published = new ArrayList<>();
        actions.subscribe(published::add);
        actions.subscribe(action -> {
            if (action instanceof OutboundAction.RegisterNamespace register) {
                namespaces.register(register.conversationKey(), new RegisteredNamespace(register.name(),
                        register.folder(), register.trigger(), TestFixtures.T0, register.containerOptions()));
            }
        });
        orchestrator = new Orchestrator(properties, new ManualLoop(), namespaces, router, persistentWorker,
                mailboxPoller, scheduler, actions);
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("registers the privileged namespace from configuration and starts its worker")
        void bootstrapsPrivileged() {
            properties.getPrivileged().setConversationKey("chat-main");

            orchestrator.start().join();

            var register = published.stream()
                    .filter(OutboundAction.RegisterNamespace.class::isInstance)
                    .map(OutboundAction.RegisterNamespace.class::cast)
                    .findFirst().orElseThrow();
            assertEquals("main", register.folder());
            assertEquals("@Parley", register.trigger());

            ArgumentCaptor<RegisteredNamespace> started = ArgumentCaptor.forClass(RegisteredNamespace.class);
            verify(persistentWorker).start(started.capture());
            assertEquals("main", started.getValue().folder());
            assertTrue(orchestrator.isRunning());
        }

        @Test
        @DisplayName("an existing registration is left alone")
        void keepsExistingRegistration() {
            namespaces.register("chat-old", new RegisteredNamespace("Main", "main", "@Parley", TestFixtures.T0, null));
            properties.getPrivileged().setConversationKey("chat-main");

            orchestrator.start().join();

            assertTrue(published.stream().noneMatch(OutboundAction.RegisterNamespace.class::isInstance));
            assertEquals("chat-old", namespaces.conversationFor("main").orElseThrow());
        }

        @Test
        @DisplayName("without a privileged namespace the worker is not started but everything else is")
        void noPrivileged() {
            orchestrator.start().join();

            verify(persistentWorker, never()).start(any());
            verify(mailboxPoller).start();
            verify(scheduler).start();
            verify(router).recover();
            assertTrue(orchestrator.isRunning());
        }

        @Test
        @DisplayName("disabled persistent worker is never started")
        void persistentDisabled() {
            properties.getPersistent().setEnabled(false);
            properties.getPrivileged().setConversationKey("chat-main");

            orchestrator.start().join();

            verify(persistentWorker, never()).start(any());
        }

        @Test
        @DisplayName("starting twice is a no-op")
        void idempotent() {
            orchestrator.start().join();
            orchestrator.start().join();

            verify(mailboxPoller, times(1)).start();
        }
    }

    @Test
    @DisplayName("shutdown stops pollers, cancels requests and drains the persistent worker")
    void shutdown() {
        when(persistentWorker.shutdown()).thenReturn(CompletableFuture.completedFuture(null));
        orchestrator.start().join();

        orchestrator.shutdown();

        InOrder inOrder = inOrder(mailboxPoller, scheduler, router, persistentWorker);
        inOrder.verify(mailboxPoller).stop();
        inOrder.verify(scheduler).stop();
        inOrder.verify(router).cancelAll();
        inOrder.verify(persistentWorker).shutdown();
        assertFalse(orchestrator.isRunning());
    }
}
