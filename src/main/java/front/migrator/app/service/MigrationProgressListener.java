package front.migrator.app.service;

import front.migrator.app.model.MigrationStatistics;

/**
 * One-way progress sink. Implementations must not influence the run; anything they throw is logged and ignored.
 */
@FunctionalInterface
public interface MigrationProgressListener {

    /**
     * @param snapshot copy of the counters after the latest item
     */
    void onItemProcessed(MigrationStatistics snapshot);
}
