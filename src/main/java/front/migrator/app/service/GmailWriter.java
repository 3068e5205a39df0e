package front.migrator.app.service;

import front.migrator.app.model.TargetLabel;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Mutating Gmail capability: label creation and label changes on threads and messages.
 * Nothing here deletes or trashes mail.
 */
public interface GmailWriter {

    /**
     * Raised when a write is attempted on a client built read-only.
     * This is a programming error, never an expected outcome.
     */
    class BlockedWriteException extends IllegalStateException {
        public BlockedWriteException(String operation) {
            super("Blocked write in read-only mode: " + operation);
        }
    }

    /**
     * Return the label named {@code name}, creating it if it does not exist yet.
     * Calling it twice with the same name never creates two labels.
     */
    TargetLabel ensureLabel(String name);

    /**
     * Bulk form of {@link #ensureLabel(String)}; refreshes the cache from Gmail first.
     * @return label name to label id, in the iteration order of {@code names}
     */
    Map<String, String> ensureLabels(Collection<String> names);

    /**
     * Apply label changes to every message of a thread.
     */
    void modifyThread(String threadId, List<String> addLabelIds, List<String> removeLabelIds);

    void modifyMessage(String messageId, List<String> addLabelIds, List<String> removeLabelIds);

    /**
     * Apply label changes to many messages; ids are sent in chunks of the Gmail batch limit.
     */
    void batchModifyMessages(List<String> messageIds, List<String> addLabelIds, List<String> removeLabelIds);

    /**
     * Archive messages by removing the INBOX label.
     */
    void archiveMessages(List<String> messageIds);
}
