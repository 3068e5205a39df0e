package front.migrator.app.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Run counters. Only ever incremented, and only by the migration loop.
 */
@Getter
@ToString
public class MigrationStatistics {
    private int total;
    private int processed;
    private int matched;
    private int unmatched;
    private int labeled;
    private int statusArchived;
    private int statusInbox;
    private int skipped;
    private int failed;

    public void setTotal(int total) {
        if (total < this.total) {
            throw new IllegalArgumentException("total cannot decrease");
        }
        this.total = total;
    }

    public void incrementProcessed() {
        processed++;
    }

    public void incrementMatched() {
        matched++;
    }

    public void incrementUnmatched() {
        unmatched++;
    }

    public void addLabeled(int count) {
        labeled += count;
    }

    public void incrementStatus(boolean archived) {
        if (archived) {
            statusArchived++;
        } else {
            statusInbox++;
        }
    }

    public void incrementSkipped() {
        skipped++;
    }

    public void incrementFailed() {
        failed++;
    }

    public MigrationStatistics snapshot() {
        MigrationStatistics copy = new MigrationStatistics();
        copy.total = total;
        copy.processed = processed;
        copy.matched = matched;
        copy.unmatched = unmatched;
        copy.labeled = labeled;
        copy.statusArchived = statusArchived;
        copy.statusInbox = statusInbox;
        copy.skipped = skipped;
        copy.failed = failed;
        return copy;
    }

    public String summaryLine() {
        return String.format("Matched: %d, Labeled: %d, Status(Arch/In): %d/%d, Skipped: %d, Failed: %d",
            matched, labeled, statusArchived, statusInbox, skipped, failed);
    }
}
