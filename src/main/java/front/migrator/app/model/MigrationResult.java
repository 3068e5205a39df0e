package front.migrator.app.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Value
public class MigrationResult {
    boolean dryRun;
    MigrationStatistics statistics;
    List<ReportRow> rows;
    Path reportPath;

    public Optional<Path> getReportPath() {
        return Optional.ofNullable(reportPath);
    }
}
