package com.parley.worker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.WaitResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * The docker-java fluent commands are mocked one by one with RETURNS_SELF; attach and wait
 * callbacks are captured so tests can push frames and exit codes through them.
 */
class DockerWorkerProviderTest {

    private DockerClient dockerClient;
    private DockerWorkerProvider provider;
    private CreateContainerCmd createCmd;
    private StartContainerCmd startCmd;
    private ResultCallback.Adapter<Frame> outputCallback;
    private ResultCallback.Adapter<WaitResponse> exitCallback;
    private final RecordingListener listener = new RecordingListener();

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        provider = new DockerWorkerProvider(dockerClient);

        var removeCmd = mock(RemoveContainerCmd.class, RETURNS_SELF);
        when(dockerClient.removeContainerCmd(anyString())).thenReturn(removeCmd);
        when(removeCmd.exec()).thenThrow(new NotFoundException("no such container"));

        createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);
        var createResponse = mock(CreateContainerResponse.class);
        when(createResponse.getId()).thenReturn("container-abc");
        when(createCmd.exec()).thenReturn(createResponse);

        var attachCmd = mock(AttachContainerCmd.class, RETURNS_SELF);
        when(dockerClient.attachContainerCmd("container-abc")).thenReturn(attachCmd);
        when(attachCmd.exec(any())).thenAnswer(invocation -> {
            ResultCallback.Adapter<Frame> callback = invocation.getArgument(0);
            callback.onStart(null);
            outputCallback = callback;
            return callback;
        });

        startCmd = mock(StartContainerCmd.class);
        when(dockerClient.startContainerCmd("container-abc")).thenReturn(startCmd);

        var waitCmd = mock(WaitContainerCmd.class);
        when(dockerClient.waitContainerCmd("container-abc")).thenReturn(waitCmd);
        when(waitCmd.exec(any())).thenAnswer(invocation -> {
            exitCallback = invocation.getArgument(0);
            return exitCallback;
        });
    }

    private static WorkerSpec spec(boolean persistent) {
        return new WorkerSpec("family-chat-1", "parley-agent:latest",
                List.of(new VolumeMount("/data/groups/family", "/workspace/group", false),
                        new VolumeMount("/data/groups/global", "/workspace/global", true)),
                Map.of("PARLEY_NAMESPACE", "family"), persistent, 1024, 2, "1000:1000");
    }

    @Test
    @DisplayName("spawn creates, attaches and starts a named container")
    void spawnStartsContainer() {
        var handle = provider.spawn(spec(false), listener);

        assertEquals("container-abc", handle.id());
        assertEquals("parley-family-chat-1", handle.name());
        assertTrue(handle.isAlive());
        verify(dockerClient).createContainerCmd("parley-agent:latest");
        verify(createCmd).withName("parley-family-chat-1");
        verify(createCmd).withEnv(List.of("PARLEY_NAMESPACE=family"));
        verify(createCmd).withUser("1000:1000");
        verify(startCmd).exec();
    }

    @Test
    @DisplayName("one-shot workers get stdin-once, persistent workers keep stdin open")
    void stdinModes() {
        provider.spawn(spec(false), listener);
        verify(createCmd).withStdInOnce(true);

        provider.spawn(spec(true), listener);
        verify(createCmd).withStdInOnce(false);
    }

    @Test
    @DisplayName("host config carries binds with access modes, limits and auto-remove")
    void hostConfig() {
        provider.spawn(spec(false), listener);

        var captor = ArgumentCaptor.forClass(HostConfig.class);
        verify(createCmd).withHostConfig(captor.capture());
        HostConfig config = captor.getValue();
        assertEquals(1024L * 1024 * 1024, config.getMemory());
        assertEquals(2L, config.getCpuCount());
        assertTrue(config.getAutoRemove());
        var binds = config.getBinds();
        assertEquals(2, binds.length);
        assertEquals(AccessMode.rw, binds[0].getAccessMode());
        assertEquals(AccessMode.ro, binds[1].getAccessMode());
        assertEquals("/workspace/global", binds[1].getVolume().getPath());
    }

    @Test
    @DisplayName("output frames are split into stdout and stderr lines")
    void outputLines() {
        provider.spawn(spec(true), listener);

        outputCallback.onNext(new Frame(StreamType.STDOUT, "{\"a\":1}\n{\"b\"".getBytes(StandardCharsets.UTF_8)));
        outputCallback.onNext(new Frame(StreamType.STDERR, "warming up\n".getBytes(StandardCharsets.UTF_8)));
        outputCallback.onNext(new Frame(StreamType.STDOUT, ":2}\n".getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("{\"a\":1}", "{\"b\":2}"), listener.stdout);
        assertEquals(List.of("warming up"), listener.stderr);
    }

    @Test
    @DisplayName("container exit flushes output and reports the status code once")
    void exitReported() {
        var handle = provider.spawn(spec(false), listener);
        outputCallback.onNext(new Frame(StreamType.STDOUT, "partial".getBytes(StandardCharsets.UTF_8)));
        outputCallback.onComplete();

        var response = mock(WaitResponse.class);
        when(response.getStatusCode()).thenReturn(3);
        exitCallback.onNext(response);
        exitCallback.onComplete();
        exitCallback.onComplete();

        assertEquals(List.of("partial"), listener.stdout);
        assertEquals(List.of(3), listener.exits);
        assertFalse(handle.isAlive());
        assertThrows(IOException.class, () -> handle.sendLine("too late"));
    }

    @Test
    @DisplayName("a create failure surfaces as WorkerUnavailableException")
    void createFailure() {
        when(createCmd.exec()).thenThrow(new RuntimeException("image not found"));

        var e = assertThrows(WorkerUnavailableException.class, () -> provider.spawn(spec(false), listener));
        assertTrue(e.getMessage().contains("parley-family-chat-1"));
        verify(dockerClient, never()).startContainerCmd(anyString());
    }

    @Test
    @DisplayName("a start failure kills the created container")
    void startFailure() {
        doThrow(new RuntimeException("port in use")).when(startCmd).exec();
        var killCmd = mock(KillContainerCmd.class);
        when(dockerClient.killContainerCmd("container-abc")).thenReturn(killCmd);

        assertThrows(WorkerUnavailableException.class, () -> provider.spawn(spec(false), listener));
        verify(killCmd).exec();
    }

    @Test
    @DisplayName("terminate tolerates a container that is already gone")
    void terminateGone() {
        var handle = provider.spawn(spec(false), listener);
        var killCmd = mock(KillContainerCmd.class);
        when(dockerClient.killContainerCmd("container-abc")).thenReturn(killCmd);
        when(killCmd.exec()).thenThrow(new NotFoundException("gone"));

        assertDoesNotThrow(handle::terminate);
        assertThrows(IOException.class, () -> {
            handle.closeInput();
            handle.sendLine("after close");
        });
    }

    private static final class RecordingListener implements WorkerListener {
        final List<String> stdout = new ArrayList<>();
        final List<String> stderr = new ArrayList<>();
        final List<Integer> exits = new ArrayList<>();

        @Override
        public void onStdout(String line) {
            stdout.add(line);
        }

        @Override
        public void onStderr(String line) {
            stderr.add(line);
        }

        @Override
        public void onExit(int exitCode) {
            exits.add(exitCode);
        }
    }
}
