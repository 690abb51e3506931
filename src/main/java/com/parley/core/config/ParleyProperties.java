package com.parley.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.regex.Pattern;

@Component
@ConfigurationProperties(prefix = "parley")
public class ParleyProperties {

    private String dataDir = "data";
    private String groupsDir = "groups";
    private String assistantName = "Parley";
    private String timezone = "";

    private Router router = new Router();
    private Persistent persistent = new Persistent();
    private Subagent subagent = new Subagent();
    private Mailbox mailbox = new Mailbox();
    private Scheduler scheduler = new Scheduler();
    private Privileged privileged = new Privileged();
    private Orchestrator orchestrator = new Orchestrator();

    public Path dataPath() { return Path.of(dataDir).toAbsolutePath(); }
    public Path groupsPath() { return Path.of(groupsDir).toAbsolutePath(); }
    public Path mailboxRoot() { return dataPath().resolve("ipc"); }

    public ZoneId zoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }

    /** Matches content addressed to the assistant, e.g. "@Parley what's up". */
    public Pattern triggerPattern() {
        return Pattern.compile("^@" + Pattern.quote(assistantName) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public String getGroupsDir() { return groupsDir; }
    public void setGroupsDir(String groupsDir) { this.groupsDir = groupsDir; }
    public String getAssistantName() { return assistantName; }
    public void setAssistantName(String assistantName) { this.assistantName = assistantName; }
    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }
    public Router getRouter() { return router; }
    public void setRouter(Router router) { this.router = router; }
    public Persistent getPersistent() { return persistent; }
    public void setPersistent(Persistent persistent) { this.persistent = persistent; }
    public Subagent getSubagent() { return subagent; }
    public void setSubagent(Subagent subagent) { this.subagent = subagent; }
    public Mailbox getMailbox() { return mailbox; }
    public void setMailbox(Mailbox mailbox) { this.mailbox = mailbox; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Privileged getPrivileged() { return privileged; }
    public void setPrivileged(Privileged privileged) { this.privileged = privileged; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }

    public static class Router {
        private Duration mergeWindow = Duration.ofSeconds(3);
        private String failureNotice = "Sorry, I could not process that. Please try again.";

        public Duration getMergeWindow() { return mergeWindow; }
        public void setMergeWindow(Duration mergeWindow) { this.mergeWindow = mergeWindow; }
        public String getFailureNotice() { return failureNotice; }
        public void setFailureNotice(String failureNotice) { this.failureNotice = failureNotice; }
    }

    public static class Persistent {
        private boolean enabled = true;
        private Duration requestTimeout = Duration.ofSeconds(90);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private int maxRestartAttempts = 3;
        private Duration restartBaseDelay = Duration.ofSeconds(1);
        private Duration shutdownGrace = Duration.ofSeconds(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getHealthCheckInterval() { return healthCheckInterval; }
        public void setHealthCheckInterval(Duration healthCheckInterval) { this.healthCheckInterval = healthCheckInterval; }
        public int getMaxRestartAttempts() { return maxRestartAttempts; }
        public void setMaxRestartAttempts(int maxRestartAttempts) { this.maxRestartAttempts = maxRestartAttempts; }
        public Duration getRestartBaseDelay() { return restartBaseDelay; }
        public void setRestartBaseDelay(Duration restartBaseDelay) { this.restartBaseDelay = restartBaseDelay; }
        public Duration getShutdownGrace() { return shutdownGrace; }
        public void setShutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; }
    }

    public static class Subagent {
        private int maxConcurrent = 3;
        private Duration contextWindow = Duration.ofMinutes(30);
        private int contextMessages = 10;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public Duration getContextWindow() { return contextWindow; }
        public void setContextWindow(Duration contextWindow) { this.contextWindow = contextWindow; }
        public int getContextMessages() { return contextMessages; }
        public void setContextMessages(int contextMessages) { this.contextMessages = contextMessages; }
    }

    public static class Mailbox {
        private Duration pollInterval = Duration.ofSeconds(1);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class Scheduler {
        private Duration pollInterval = Duration.ofSeconds(60);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class Privileged {
        private String folder = "main";
        private String name = "main";
        private String conversationKey = "";

        public String getFolder() { return folder; }
        public void setFolder(String folder) { this.folder = folder; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getConversationKey() { return conversationKey; }
        public void setConversationKey(String conversationKey) { this.conversationKey = conversationKey; }
    }

    public static class Orchestrator {
        private boolean autoStart = false;

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
    }
}
