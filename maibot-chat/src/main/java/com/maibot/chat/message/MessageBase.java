package com.maibot.chat.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire-level message exchanged with platform adapters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MessageBase {

    private static final ObjectMapper JSON = new ObjectMapper();

    private BaseMessageInfo messageInfo;
    private Seg messageSegment;
    /** Raw message including unparsed CQ codes. */
    private String rawMessage;

    public static MessageBase fromJson(String json) throws JsonProcessingException {
        return JSON.readValue(json, MessageBase.class);
    }

    public String toJson() throws JsonProcessingException {
        return JSON.writeValueAsString(this);
    }
}
