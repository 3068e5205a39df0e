package front.migrator.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.PropertySource;


@ConfigurationPropertiesScan(basePackages = "front.migrator.app.config")
@PropertySource(value = "file:./secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication
public class MigratorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MigratorApplication.class, args)));
    }

}
