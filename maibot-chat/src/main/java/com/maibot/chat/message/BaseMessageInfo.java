package com.maibot.chat.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Routing metadata of a message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BaseMessageInfo {
    private String platform;
    /** Platform message id; numeric ids are kept as their string form. */
    private String messageId;
    /** Epoch seconds. */
    private Long time;
    private GroupInfo groupInfo;
    private UserInfo userInfo;
}
