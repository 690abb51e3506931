package com.parley.core.router;

import com.parley.core.model.Attachment;
import com.parley.core.model.ConversationMessage;

import java.util.List;

/**
 * Turns stored conversation history into the text handed to a worker.
 */
public class PromptRenderer {

    static final String SCHEDULED_PREAMBLE = "[SCHEDULED TASK - You are running automatically, not in response "
            + "to a user message. Write to your mailbox's messages/ queue if you need to reach the user.]";

    public String renderBatch(List<ConversationMessage> messages) {
        var sb = new StringBuilder("<messages>\n");
        for (ConversationMessage m : messages) {
            sb.append("<message sender=\"").append(escape(m.senderName()))
              .append("\" time=\"").append(m.timestamp())
              .append("\" type=\"").append(escape(m.messageType())).append("\">");
            if (m.quoted() != null) {
                sb.append("\n  <quoted sender=\"").append(escape(m.quoted().senderName())).append("\">")
                  .append(escape(m.quoted().content())).append("</quoted>");
            }
            for (Attachment att : m.attachments()) {
                sb.append("\n  <").append(tagName(att.type()))
                  .append(" path=\"").append(escape(att.filePath())).append('"');
                if (att.fileName() != null) sb.append(" fileName=\"").append(escape(att.fileName())).append('"');
                if (att.fileSize() != null) sb.append(" fileSize=\"").append(att.fileSize()).append('"');
                if (att.mimeType() != null) sb.append(" mimeType=\"").append(escape(att.mimeType())).append('"');
                sb.append(" />");
            }
            if (m.content() != null && !m.content().isEmpty()) {
                sb.append("\n  ").append(escape(m.content()));
            }
            sb.append("\n</message>\n");
        }
        return sb.append("</messages>").toString();
    }

    /** Prefixes a subagent task with recent conversation history, if there is any. */
    public String withRecentContext(List<ConversationMessage> recent, String task) {
        if (recent.isEmpty()) {
            return task;
        }
        var sb = new StringBuilder("<recent_context>\n");
        for (ConversationMessage m : recent) {
            sb.append("<message sender=\"").append(escape(m.senderName()))
              .append("\" time=\"").append(m.timestamp()).append("\">")
              .append(escape(m.content())).append("</message>\n");
        }
        return sb.append("</recent_context>\n\n").append(task).toString();
    }

    public String scheduled(String prompt) {
        return SCHEDULED_PREAMBLE + "\n\n" + prompt;
    }

    static String escape(String value) {
        if (value == null) return "";
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    private static String tagName(String type) {
        return type == null || !type.matches("[A-Za-z][A-Za-z0-9_-]*") ? "attachment" : type;
    }
}
