package front.migrator.app.service;

import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListLabelsResponse;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import com.google.api.services.gmail.model.ModifyThreadRequest;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

public class GoogleGmailGateway implements GmailGateway {
    private final Gmail gmail;
    private final String userId;

    public GoogleGmailGateway(Gmail gmail, String userId) {
        this.gmail = gmail;
        this.userId = userId;
    }

    @Override
    public List<Label> listLabels() throws IOException {
        ListLabelsResponse response = gmail.users().labels().list(userId).execute();
        return response.getLabels() != null ? response.getLabels() : Collections.emptyList();
    }

    @Override
    public Label createLabel(Label label) throws IOException {
        return gmail.users().labels().create(userId, label).execute();
    }

    @Override
    public ListMessagesResponse listMessages(String query, long maxResults) throws IOException {
        return gmail.users().messages().list(userId)
            .setQ(query)
            .setMaxResults(maxResults)
            .execute();
    }

    @Override
    public Message getMessage(String messageId, String format) throws IOException {
        return gmail.users().messages().get(userId, messageId)
            .setFormat(format)
            .execute();
    }

    @Override
    public void modifyThread(String threadId, ModifyThreadRequest request) throws IOException {
        gmail.users().threads().modify(userId, threadId, request).execute();
    }

    @Override
    public void modifyMessage(String messageId, ModifyMessageRequest request) throws IOException {
        gmail.users().messages().modify(userId, messageId, request).execute();
    }

    @Override
    public void batchModifyMessages(BatchModifyMessagesRequest request) throws IOException {
        gmail.users().messages().batchModify(userId, request).execute();
    }
}
