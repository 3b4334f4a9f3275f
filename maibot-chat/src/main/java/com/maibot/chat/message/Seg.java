package com.maibot.chat.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A message segment. Leaf segments carry string data ({@code text}, base64
 * {@code image}, {@code emoji}, ...); {@code seglist} segments carry a list of
 * child segments.
 */
@EqualsAndHashCode
@ToString
public final class Seg {

    public static final String TEXT = "text";
    public static final String IMAGE = "image";
    public static final String EMOJI = "emoji";
    public static final String SEGLIST = "seglist";

    private final String type;
    private final String text;
    private final List<Seg> children;

    private Seg(String type, String text, List<Seg> children) {
        this.type = type;
        this.text = text;
        this.children = children;
    }

    public static Seg of(String type, String data) {
        return new Seg(type, data, List.of());
    }

    public static Seg text(String text) {
        return of(TEXT, text);
    }

    public static Seg list(List<Seg> children) {
        return new Seg(SEGLIST, null, List.copyOf(children));
    }

    @JsonCreator
    static Seg fromJson(@JsonProperty("type") String type, @JsonProperty("data") JsonNode data) {
        if (SEGLIST.equals(type)) {
            List<Seg> children = new ArrayList<>();
            if (data != null && data.isArray()) {
                for (JsonNode child : data) {
                    JsonNode childType = child.get("type");
                    children.add(fromJson(childType != null ? childType.asText() : null, child.get("data")));
                }
            }
            return list(children);
        }
        String text = data == null || data.isNull() ? null : data.isTextual() ? data.asText() : data.toString();
        return of(type, text);
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    /** String data for leaf segments, the child list for {@code seglist}. */
    @JsonProperty("data")
    public Object getData() {
        return isList() ? children : text;
    }

    @JsonIgnore
    public String getText() {
        return text;
    }

    @JsonIgnore
    public List<Seg> getChildren() {
        return children;
    }

    @JsonIgnore
    public boolean isList() {
        return SEGLIST.equals(type);
    }

    /**
     * Render this segment as the plain text the chat pipeline reasons over.
     */
    public String toPlainText() {
        if (type == null) {
            return "";
        }
        switch (type) {
            case TEXT:
                return text != null ? text : "";
            case IMAGE:
                return "[图片]";
            case EMOJI:
                return "[表情包]";
            case SEGLIST: {
                StringBuilder sb = new StringBuilder();
                for (Seg child : children) {
                    sb.append(child.toPlainText());
                }
                return sb.toString();
            }
            default:
                return "";
        }
    }
}
