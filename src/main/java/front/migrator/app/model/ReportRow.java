package front.migrator.app.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One line of the audit trail: what was decided for a single Front conversation.
 */
@Value
@Builder
public class ReportRow {
    String frontConversationId;
    String subject;
    Instant createdAt;
    boolean archived;
    MatchMethod matchMethod;
    int gmailResults;
    String gmailMessageId;
    String threadId;
    @Builder.Default
    List<String> labelsToAdd = List.of();
    @Builder.Default
    List<String> labelsToRemove = List.of();
    MigrationAction action;
    String reason;

    /**
     * Starts a row carrying the identifying columns of {@code item}.
     */
    public static ReportRowBuilder forItem(MigrationItem item) {
        return ReportRow.builder()
            .frontConversationId(item.getFrontConversationId())
            .subject(item.getSubject())
            .createdAt(item.getCreatedAt())
            .archived(item.isArchived())
            .matchMethod(item.getRfc822MessageId().isPresent() ? MatchMethod.MESSAGE_ID : MatchMethod.NONE);
    }
}
