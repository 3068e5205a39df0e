package front.migrator.app.service;

import front.migrator.app.model.MigrationStatistics;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingProgressListener implements MigrationProgressListener {

    @Override
    public void onItemProcessed(MigrationStatistics snapshot) {
        int total = snapshot.getTotal();
        int percentage = total == 0 ? 100 : Math.round(snapshot.getProcessed() * 100f / total);
        log.info("{}% ({}/{}) - {}", percentage, snapshot.getProcessed(), total, snapshot.summaryLine());
    }
}
