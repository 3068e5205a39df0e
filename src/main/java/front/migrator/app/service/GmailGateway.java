package front.migrator.app.service;

import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import com.google.api.services.gmail.model.ModifyThreadRequest;

import java.io.IOException;
import java.util.List;

/**
 * One method per Gmail REST call the migration needs, nothing more.
 * Retry, rate limiting and the read-only guard live in {@link GmailService}.
 */
public interface GmailGateway {

    List<Label> listLabels() throws IOException;

    Label createLabel(Label label) throws IOException;

    ListMessagesResponse listMessages(String query, long maxResults) throws IOException;

    Message getMessage(String messageId, String format) throws IOException;

    void modifyThread(String threadId, ModifyThreadRequest request) throws IOException;

    void modifyMessage(String messageId, ModifyMessageRequest request) throws IOException;

    void batchModifyMessages(BatchModifyMessagesRequest request) throws IOException;
}
