package front.migrator.app.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Run configuration. Defaults to a dry run: nothing is written to Gmail unless
 * migration.dry-run is explicitly false.
 */
@Data
@ConfigurationProperties(prefix = "migration")
public class MigrationProperties {
    private int batchSize = 10;

    // Anything other than "false" keeps the run non-mutating
    private String dryRun = "true";

    private boolean skipArchived = false;

    // Restrict the run to one Front inbox
    private String inboxId;

    private String reportDirectory = "reports";
    private Duration batchDelay = Duration.ofSeconds(1);

    @PostConstruct
    public void validate() {
        if (batchSize < 1) {
            throw new IllegalStateException("migration.batch-size must be a positive integer, got " + batchSize);
        }
        if (batchDelay == null || batchDelay.isNegative()) {
            throw new IllegalStateException("migration.batch-delay must not be negative");
        }
    }

    public boolean isDryRun() {
        return dryRun == null || !dryRun.trim().equalsIgnoreCase("false");
    }

    public boolean hasInboxFilter() {
        return inboxId != null && !inboxId.isBlank();
    }
}
