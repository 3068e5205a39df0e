package front.migrator.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "google")
public class GoogleProperties {
    private String credentialsPath = "./credentials.json";
    private String tokenPath = "./token.json";
    private String applicationName = "Front Gmail Migrator";
    private String userId = "me";
    private int maxConcurrentCalls = 5;
}
