package front.migrator.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Backoff envelope shared by the Front and Gmail clients.
 */
@Data
@ConfigurationProperties(prefix = "retry")
public class RetryProperties {
    private int maxAttempts = 3;
    private Duration baseDelay = Duration.ofMillis(500);
    private Duration maxJitter = Duration.ofMillis(100);
}
