package front.migrator.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "front")
public class FrontProperties {
    private String apiKey;
    private String baseUrl = "https://api2.frontapp.com";
    private String tokenFile = "front_token.json";
    private int pageSize = 100;
    private int maxConcurrentCalls = 2;
}
