package front.migrator.app.model;

import lombok.Value;

@Value
public class GmailMatch {
    String messageId;
    String threadId;
    int resultCount;
}
