package front.migrator.app;

import front.migrator.app.model.MigrationResult;
import front.migrator.app.model.MigrationStatistics;
import front.migrator.app.service.FrontApiService;
import front.migrator.app.service.GmailReader;
import front.migrator.app.service.LabelReconciliationException;
import front.migrator.app.service.MigrationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MigrationCommandLineRunnerTest {

    @Mock
    private MigrationService migrationService;

    private MigrationCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        runner = new MigrationCommandLineRunner(migrationService);
    }

    @Test
    void run_WhenMigrationCompletes_ShouldExitZero() {
        // Given
        when(migrationService.run()).thenReturn(new MigrationResult(true, new MigrationStatistics(), List.of(), null));

        // When
        runner.run();

        // Then
        assertEquals(MigrationCommandLineRunner.EXIT_OK, runner.getExitCode());
    }

    @Test
    void run_WhenFrontRejectsToken_ShouldExitWithAuthCode() {
        // Given
        when(migrationService.run()).thenThrow(new FrontApiService.SourceAuthException("FRONT_AUTH_401: bad token", null));

        // When
        runner.run();

        // Then
        assertEquals(MigrationCommandLineRunner.EXIT_AUTH, runner.getExitCode());
    }

    @Test
    void run_WhenGmailRejectsCredential_ShouldExitWithAuthCode() {
        // Given
        when(migrationService.run()).thenThrow(new GmailReader.TargetAuthException("expired", null));

        // When
        runner.run();

        // Then
        assertEquals(MigrationCommandLineRunner.EXIT_AUTH, runner.getExitCode());
    }

    @Test
    void run_WhenLabelsCannotBeReconciled_ShouldExitWithFailure() {
        // Given
        when(migrationService.run()).thenThrow(new LabelReconciliationException("quota", null));

        // When
        runner.run();

        // Then
        assertEquals(MigrationCommandLineRunner.EXIT_FAILED, runner.getExitCode());
    }
}
