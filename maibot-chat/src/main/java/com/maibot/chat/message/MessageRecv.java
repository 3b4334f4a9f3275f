package com.maibot.chat.message;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.Optional;

/**
 * An inbound message after segment processing.
 */
public class MessageRecv {

    private final MessageBase message;
    private final String processedPlainText;

    public MessageRecv(MessageBase message) {
        this.message = message;
        Seg segment = message.getMessageSegment();
        this.processedPlainText = segment != null ? segment.toPlainText() : null;
    }

    public static MessageRecv fromJson(String json) throws JsonProcessingException {
        return new MessageRecv(MessageBase.fromJson(json));
    }

    public MessageBase getMessage() {
        return message;
    }

    public BaseMessageInfo getMessageInfo() {
        return message.getMessageInfo();
    }

    public String getProcessedPlainText() {
        return processedPlainText;
    }

    public String getMessageId() {
        BaseMessageInfo info = message.getMessageInfo();
        return info != null ? info.getMessageId() : null;
    }

    /** Plain text, if the message carried any. */
    public Optional<String> plainText() {
        if (processedPlainText == null || processedPlainText.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(processedPlainText);
    }

    /**
     * Display name of the sender: nickname, then group card name, then id.
     */
    public Optional<String> senderName() {
        BaseMessageInfo info = message.getMessageInfo();
        if (info == null || info.getUserInfo() == null) {
            return Optional.empty();
        }
        UserInfo user = info.getUserInfo();
        if (user.getUserNickname() != null && !user.getUserNickname().isBlank()) {
            return Optional.of(user.getUserNickname());
        }
        if (user.getUserCardname() != null && !user.getUserCardname().isBlank()) {
            return Optional.of(user.getUserCardname());
        }
        return Optional.ofNullable(user.getUserId()).map(String::valueOf);
    }

    @Override
    public String toString() {
        return "MessageRecv{id=" + getMessageId() + ", text=" + processedPlainText + "}";
    }
}
