package front.migrator.app;

import front.migrator.app.model.MigrationResult;
import front.migrator.app.service.FrontApiService;
import front.migrator.app.service.GmailReader;
import front.migrator.app.service.LabelReconciliationException;
import front.migrator.app.service.MigrationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the migration once at startup and turns the outcome into a process exit code.
 */
@Slf4j
@Component
public class MigrationCommandLineRunner implements CommandLineRunner, ExitCodeGenerator {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_AUTH = 2;

    private final MigrationService migrationService;
    private int exitCode = EXIT_OK;

    public MigrationCommandLineRunner(MigrationService migrationService) {
        this.migrationService = migrationService;
    }

    @Override
    public void run(String... args) {
        log.info("Front to Gmail Migration Tool");
        try {
            MigrationResult result = migrationService.run();
            result.getReportPath().ifPresent(path -> log.info("Report: {}", path.toAbsolutePath()));
            log.info("Migration completed successfully!");
        } catch (FrontApiService.SourceAuthException e) {
            log.error("Front rejected the API token: {}. Check FRONT_API_KEY and try again.", e.getMessage());
            exitCode = EXIT_AUTH;
        } catch (GmailReader.TargetAuthException e) {
            log.error("Gmail rejected the stored credential: {}. Re-authorize Gmail access and try again.", e.getMessage());
            exitCode = EXIT_AUTH;
        } catch (LabelReconciliationException e) {
            log.error("Migration aborted: {}", e.getMessage());
            exitCode = EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("Migration failed with error: {}", e.getMessage(), e);
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
