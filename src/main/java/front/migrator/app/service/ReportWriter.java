package front.migrator.app.service;

import front.migrator.app.model.ReportRow;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists the per-item decision trail of one run.
 */
public interface ReportWriter {

    /**
     * @param rows report rows in processing order
     * @return the file written
     * @throws IOException if the report cannot be written
     */
    Path write(List<ReportRow> rows) throws IOException;
}
