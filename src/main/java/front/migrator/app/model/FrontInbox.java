package front.migrator.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class FrontInbox {
    private String id;
    private String name;

    @JsonProperty("is_private")
    private boolean privateInbox;
}
