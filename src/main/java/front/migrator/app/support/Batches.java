package front.migrator.app.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Batches {

    private Batches() {
    }

    /**
     * Splits {@code items} into consecutive groups of {@code batchSize}; the last group may be shorter.
     */
    public static <T> List<List<T>> partition(List<T> items, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < items.size(); i += batchSize) {
            int endIndex = Math.min(i + batchSize, items.size());
            batches.add(Collections.unmodifiableList(new ArrayList<>(items.subList(i, endIndex))));
        }
        return batches;
    }
}
