package com.maibot.chat.followup;

import com.maibot.chat.message.MessageRecv;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders collected follow-up messages as the text handed to the judge.
 */
public final class ConversationContext {

    private ConversationContext() {
    }

    /**
     * One {@code sender: text} line per message. Messages without a sender or
     * without plain text are left out.
     */
    public static String build(List<MessageRecv> messages) {
        List<String> lines = new ArrayList<>(messages.size());
        for (MessageRecv message : messages) {
            if (message == null) {
                continue;
            }
            Optional<String> sender = message.senderName();
            Optional<String> text = message.plainText();
            if (sender.isPresent() && text.isPresent()) {
                lines.add(sender.get() + ": " + text.get());
            }
        }
        return String.join("\n", lines);
    }
}
