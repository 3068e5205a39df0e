package front.migrator.app.service;

import front.migrator.app.model.TargetLabel;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Gmail label name to label lookup, keyed case-insensitively.
 * Owned by a single {@link GmailService}; all access is synchronized.
 */
public class LabelCache {
    private final Map<String, TargetLabel> labels = new HashMap<>();

    public synchronized Optional<TargetLabel> get(String name) {
        return Optional.ofNullable(labels.get(key(name)));
    }

    public synchronized void put(TargetLabel label) {
        labels.put(key(label.getName()), label);
    }

    public synchronized void putAll(List<TargetLabel> fetched) {
        fetched.forEach(label -> labels.put(key(label.getName()), label));
    }

    public synchronized int size() {
        return labels.size();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
