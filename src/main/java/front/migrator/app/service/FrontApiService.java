package front.migrator.app.service;

import front.migrator.app.model.FrontConversation;
import front.migrator.app.model.FrontInbox;
import front.migrator.app.model.FrontMessage;
import front.migrator.app.model.FrontTag;

import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only access to the Front API.
 * This abstraction allows the migration to be tested without a live Front account.
 */
public interface FrontApiService {

    /**
     * Raised when Front rejects the API token (HTTP 401). Never retried.
     */
    class SourceAuthException extends RuntimeException {
        public SourceAuthException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised for any other Front failure, once retries (if applicable) are exhausted.
     */
    class FrontApiException extends RuntimeException {
        private final int statusCode;

        public FrontApiException(String message, int statusCode, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        /**
         * @return the HTTP status, or 0 when the request never got a response
         */
        public int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * Lazily walk every conversation, one page at a time, in Front's order.
     * @param inboxId restrict to this inbox, or null for all conversations
     * @return conversations in pagination order; pages are fetched as the stream is consumed
     * @throws SourceAuthException if the token is rejected
     */
    Stream<FrontConversation> streamConversations(String inboxId);

    /**
     * Eager form of {@link #streamConversations(String)}.
     */
    List<FrontConversation> listAllConversations(String inboxId);

    /**
     * @return all inboxes visible to the token
     */
    List<FrontInbox> listInboxes();

    /**
     * @return the tag taxonomy of the Front company
     */
    List<FrontTag> listTags();

    /**
     * @param conversationId Front conversation id
     * @return messages of the conversation, oldest first
     */
    List<FrontMessage> listConversationMessages(String conversationId);
}
