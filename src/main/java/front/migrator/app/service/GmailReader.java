package front.migrator.app.service;

import front.migrator.app.model.GmailMatch;
import front.migrator.app.model.TargetLabel;

import java.util.List;
import java.util.Optional;

/**
 * Read-only Gmail capability. A dry run is only ever handed this interface.
 */
public interface GmailReader {

    /**
     * Raised when Google rejects the credential (HTTP 401). Never retried.
     */
    class TargetAuthException extends RuntimeException {
        public TargetAuthException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * List every label of the mailbox and refresh the label cache with them.
     * @return labels, system and user
     */
    List<TargetLabel> listLabels();

    /**
     * Exact lookup by RFC 822 Message-ID (no fuzzy search).
     * @param rfc822MessageId Message-ID without angle brackets
     * @return the matching message and its thread, or empty when Gmail has no such message
     */
    Optional<GmailMatch> findByRfc822MessageId(String rfc822MessageId);

    /**
     * Cache-only lookup of a label id by name, case-insensitive. Never calls Gmail.
     */
    Optional<String> resolveLabelId(String labelName);
}
