package front.migrator.app.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized, in-memory view of one Front conversation, built by the mapper and discarded at the end of a run.
 */
@Value
@Builder
public class MigrationItem {
    String frontConversationId;
    String subject;
    boolean archived;

    @Singular
    List<String> labels;

    // Cleaned RFC 822 Message-ID, null when no email message carried one
    String rfc822MessageId;

    // Not used for matching
    @Singular
    Set<String> participantAddresses;

    Instant createdAt;

    public Optional<String> getRfc822MessageId() {
        return Optional.ofNullable(rfc822MessageId);
    }
}
