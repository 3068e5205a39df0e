package front.migrator.app.service;

import front.migrator.app.model.ReportRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
public class CsvReportWriter implements ReportWriter {
    public static final String FILE_PREFIX = "migration-report-";

    static final String[] HEADERS = {
        "frontConversationId", "subject", "createdAt", "isArchived", "matchMethod", "gmailResults",
        "gmailMessageId", "threadId", "labelsToAdd", "labelsToRemove", "action", "reason"
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setQuoteMode(QuoteMode.ALL)
        .setRecordSeparator("\n")
        .setHeader(HEADERS)
        .build();

    private final Path directory;
    private final Clock clock;

    public CsvReportWriter(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    @Override
    public Path write(List<ReportRow> rows) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(fileName(Instant.now(clock)));
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
            for (ReportRow row : rows) {
                printer.printRecord(
                    nullToEmpty(row.getFrontConversationId()),
                    nullToEmpty(row.getSubject()),
                    row.getCreatedAt() != null ? row.getCreatedAt().toString() : "",
                    String.valueOf(row.isArchived()),
                    row.getMatchMethod() != null ? row.getMatchMethod().getValue() : "",
                    String.valueOf(row.getGmailResults()),
                    nullToEmpty(row.getGmailMessageId()),
                    nullToEmpty(row.getThreadId()),
                    String.join(";", row.getLabelsToAdd()),
                    String.join(";", row.getLabelsToRemove()),
                    row.getAction() != null ? row.getAction().getValue() : "",
                    nullToEmpty(row.getReason()));
            }
        }
        log.info("CSV report written to {}", file.toAbsolutePath());
        return file;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * {@code migration-report-2024-05-01T10-15-30-123Z.csv}: ISO-8601 with ':' and '.' made filesystem safe.
     */
    static String fileName(Instant timestamp) {
        return FILE_PREFIX + timestamp.toString().replaceAll("[:.]", "-") + ".csv";
    }
}
