package front.migrator.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FrontConversation {
    public static final String STATUS_ARCHIVED = "archived";

    private String id;

    private String subject;

    // archived, unassigned, assigned, deleted, spam, ... kept as a raw string
    private String status;

    private List<FrontTag> tags = new ArrayList<>();

    private List<FrontMessage> messages = new ArrayList<>();

    // Epoch seconds, possibly fractional
    @JsonProperty("created_at")
    private Double createdAt;

    @JsonProperty("updated_at")
    private Double updatedAt;
}
