package front.migrator.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FrontMessage {
    public static final String TYPE_EMAIL = "email";
    public static final String HEADER_MESSAGE_ID = "message-id";

    private String id;

    // email, sms, custom, ...
    private String type;

    private String subject;

    private FrontRecipient from;

    private List<FrontRecipient> recipients = new ArrayList<>();

    @JsonProperty("is_inbound")
    private boolean inbound;

    @JsonProperty("created_at")
    private Double createdAt;

    private Metadata metadata;

    public boolean isEmail() {
        return TYPE_EMAIL.equals(type);
    }

    /**
     * Returns the value of a protocol header, matching the header name case-insensitively.
     */
    public String header(String name) {
        if (metadata == null || metadata.getHeaders() == null) {
            return null;
        }
        for (Map.Entry<String, String> header : metadata.getHeaders().entrySet()) {
            if (header.getKey() != null && header.getKey().equalsIgnoreCase(name)) {
                return header.getValue();
            }
        }
        return null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        private Map<String, String> headers;
    }
}
