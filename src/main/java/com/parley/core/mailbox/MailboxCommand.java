package com.parley.core.mailbox;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.parley.core.model.ContainerOptions;

/**
 * Closed set of commands a worker may drop into its mailbox, discriminated by {@code type}.
 *
 * <p>Required fields are checked on construction, so a file that decodes is structurally valid.
 * Nothing here identifies the sender: that comes from the directory the file was found in.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = MailboxCommand.Message.class, name = "message"),
    @JsonSubTypes.Type(value = MailboxCommand.ScheduleTask.class, name = "schedule_task"),
    @JsonSubTypes.Type(value = MailboxCommand.PauseTask.class, name = "pause_task"),
    @JsonSubTypes.Type(value = MailboxCommand.ResumeTask.class, name = "resume_task"),
    @JsonSubTypes.Type(value = MailboxCommand.CancelTask.class, name = "cancel_task"),
    @JsonSubTypes.Type(value = MailboxCommand.RegisterNamespace.class, name = "register_namespace"),
    @JsonSubTypes.Type(value = MailboxCommand.SpawnSubagent.class, name = "spawn_subagent"),
    @JsonSubTypes.Type(value = MailboxCommand.RefreshSnapshot.class, name = "refresh_snapshot")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public interface MailboxCommand {

    /** Wire name of the command, used for logging and metrics. */
    String type();

    /** Sends text to a conversation. The only command accepted from the {@code messages/} subqueue. */
    record Message(
        @JsonAlias("chatJid") String conversationKey,
        String text
    ) implements MailboxCommand {
        public Message {
            require(conversationKey, "conversationKey");
            require(text, "text");
        }

        @Override
        public String type() { return "message"; }
    }

    /**
     * @param targetNamespace folder of the namespace the task runs for; the sender's own when absent
     */
    record ScheduleTask(
        String prompt,
        @JsonAlias("schedule_type") String scheduleType,
        @JsonAlias("schedule_value") String scheduleValue,
        @JsonAlias("context_mode") String contextMode,
        @JsonAlias("groupFolder") String targetNamespace
    ) implements MailboxCommand {
        public ScheduleTask {
            require(prompt, "prompt");
            require(scheduleType, "scheduleType");
            require(scheduleValue, "scheduleValue");
        }

        @Override
        public String type() { return "schedule_task"; }
    }

    record PauseTask(String taskId) implements MailboxCommand {
        public PauseTask {
            require(taskId, "taskId");
        }

        @Override
        public String type() { return "pause_task"; }
    }

    record ResumeTask(String taskId) implements MailboxCommand {
        public ResumeTask {
            require(taskId, "taskId");
        }

        @Override
        public String type() { return "resume_task"; }
    }

    record CancelTask(String taskId) implements MailboxCommand {
        public CancelTask {
            require(taskId, "taskId");
        }

        @Override
        public String type() { return "cancel_task"; }
    }

    record RegisterNamespace(
        @JsonAlias("jid") String conversationKey,
        String name,
        String folder,
        String trigger,
        @JsonAlias("containerConfig") ContainerOptions containerOptions
    ) implements MailboxCommand {
        public RegisterNamespace {
            require(conversationKey, "conversationKey");
            require(name, "name");
            require(folder, "folder");
            require(trigger, "trigger");
        }

        @Override
        public String type() { return "register_namespace"; }
    }

    record SpawnSubagent(
        String task,
        @JsonAlias("chatJid") String conversationKey,
        Boolean includeContext
    ) implements MailboxCommand {
        public SpawnSubagent {
            require(task, "task");
            require(conversationKey, "conversationKey");
            includeContext = includeContext != null ? includeContext : Boolean.FALSE;
        }

        @Override
        public String type() { return "spawn_subagent"; }
    }

    record RefreshSnapshot(String reason) implements MailboxCommand {
        @Override
        public String type() { return "refresh_snapshot"; }
    }

    private static void require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required field '" + field + "'");
        }
    }
}
