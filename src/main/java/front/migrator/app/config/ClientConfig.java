package front.migrator.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.gmail.Gmail;
import front.migrator.app.service.CredentialProvider;
import front.migrator.app.service.CsvReportWriter;
import front.migrator.app.service.FileCredentialProvider;
import front.migrator.app.service.FrontApiService;
import front.migrator.app.service.FrontService;
import front.migrator.app.service.GmailService;
import front.migrator.app.service.GoogleGmailGateway;
import front.migrator.app.service.LoggingProgressListener;
import front.migrator.app.service.MigrationProgressListener;
import front.migrator.app.service.ReportWriter;
import front.migrator.app.service.TargetAccess;
import front.migrator.app.support.AdmissionLimiter;
import front.migrator.app.support.RetryPolicy;
import front.migrator.app.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.time.Clock;

/**
 * Wires the Front and Gmail clients for one run.
 * In a dry run the Gmail client is built read-only and handed out only as a reader.
 */
@Slf4j
@Configuration
public class ClientConfig {

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonFactory jsonFactory() {
        return GsonFactory.getDefaultInstance();
    }

    @Bean
    public HttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public CredentialProvider credentialProvider(FrontProperties frontProperties, GoogleProperties googleProperties,
                                                 HttpTransport googleHttpTransport, JsonFactory jsonFactory,
                                                 ObjectMapper objectMapper) {
        return new FileCredentialProvider(frontProperties, googleProperties, googleHttpTransport, jsonFactory, objectMapper);
    }

    @Bean
    public FrontApiService frontApiService(FrontProperties frontProperties, RetryProperties retryProperties,
                                           CredentialProvider credentialProvider, ObjectMapper objectMapper,
                                           Sleeper sleeper) {
        String apiToken = credentialProvider.frontApiToken();
        RestTemplate restTemplate = new RestTemplateBuilder()
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .build();
        return new FrontService(restTemplate, objectMapper, frontProperties.getBaseUrl(), frontProperties.getPageSize(),
            new AdmissionLimiter(frontProperties.getMaxConcurrentCalls()), retryPolicy(retryProperties, sleeper));
    }

    @Bean
    public TargetAccess targetAccess(MigrationProperties migrationProperties, GoogleProperties googleProperties,
                                     RetryProperties retryProperties, CredentialProvider credentialProvider,
                                     HttpTransport googleHttpTransport, JsonFactory jsonFactory, Sleeper sleeper) {
        Credential credential = credentialProvider.gmailCredential();
        Gmail gmail = new Gmail.Builder(googleHttpTransport, jsonFactory, credential)
            .setApplicationName(googleProperties.getApplicationName())
            .build();

        boolean readOnly = migrationProperties.isDryRun();
        GmailService gmailService = new GmailService(
            new GoogleGmailGateway(gmail, googleProperties.getUserId()),
            new AdmissionLimiter(googleProperties.getMaxConcurrentCalls()),
            retryPolicy(retryProperties, sleeper),
            readOnly);
        log.info("Gmail client initialized ({})", readOnly ? "read-only" : "read-write");
        return readOnly ? TargetAccess.readOnly(gmailService) : TargetAccess.readWrite(gmailService, gmailService);
    }

    @Bean
    public ReportWriter reportWriter(MigrationProperties migrationProperties, Clock clock) {
        return new CsvReportWriter(Paths.get(migrationProperties.getReportDirectory()), clock);
    }

    @Bean
    public MigrationProgressListener migrationProgressListener() {
        return new LoggingProgressListener();
    }

    private static RetryPolicy retryPolicy(RetryProperties retryProperties, Sleeper sleeper) {
        return new RetryPolicy(retryProperties.getMaxAttempts(), retryProperties.getBaseDelay(),
            retryProperties.getMaxJitter(), sleeper);
    }
}
