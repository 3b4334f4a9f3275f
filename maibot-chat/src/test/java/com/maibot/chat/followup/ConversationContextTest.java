package com.maibot.chat.followup;

import com.maibot.chat.message.BaseMessageInfo;
import com.maibot.chat.message.MessageBase;
import com.maibot.chat.message.MessageRecv;
import com.maibot.chat.message.Seg;
import com.maibot.chat.message.UserInfo;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationContextTest {

    @Test
    void build_oneLinePerMessageInOrder() {
        String context = ConversationContext.build(List.of(
                TestMessages.text("alice", "早上好"),
                TestMessages.text("bob", "麦麦呢")));

        assertEquals("alice: 早上好\nbob: 麦麦呢", context);
    }

    @Test
    void build_skipsMessagesWithoutSenderOrText() {
        MessageRecv noSegment = new MessageRecv(MessageBase.builder()
                .messageInfo(BaseMessageInfo.builder()
                        .userInfo(UserInfo.builder().userNickname("carol").build())
                        .build())
                .build());

        String context = ConversationContext.build(Arrays.asList(
                TestMessages.anonymous("who am i"),
                noSegment,
                null,
                TestMessages.text("dave", "hello")));

        assertEquals("dave: hello", context);
    }

    @Test
    void build_usesCardNameWhenNicknameMissing() {
        MessageRecv message = new MessageRecv(MessageBase.builder()
                .messageInfo(BaseMessageInfo.builder()
                        .userInfo(UserInfo.builder().userId(42L).userCardname("群名片").build())
                        .build())
                .messageSegment(Seg.list(List.of(Seg.text("看"), Seg.of(Seg.IMAGE, "aGVsbG8="))))
                .build());

        assertEquals("群名片: 看[图片]", ConversationContext.build(List.of(message)));
    }

    @Test
    void build_emptyList() {
        assertEquals("", ConversationContext.build(List.of()));
    }
}
