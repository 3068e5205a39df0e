package front.migrator.app.service;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import com.google.api.services.gmail.model.BatchModifyMessagesRequest;
import com.google.api.services.gmail.model.Label;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.ModifyMessageRequest;
import com.google.api.services.gmail.model.ModifyThreadRequest;
import front.migrator.app.model.GmailMatch;
import front.migrator.app.model.TargetLabel;
import front.migrator.app.support.AdmissionLimiter;
import front.migrator.app.support.RemoteCallResult;
import front.migrator.app.support.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gmail label reconciliation and label mutation.
 * Every call goes through the admission limiter and the retry policy; every write first
 * checks the read-only flag fixed at construction.
 */
@Slf4j
public class GmailService implements GmailReader, GmailWriter {
    public static final int MAX_BATCH_MODIFY_IDS = 1000;
    static final String INBOX_LABEL_ID = "INBOX";

    // Reasons Gmail reports on 403 responses that are really rate limiting
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");

    private final GmailGateway gateway;
    private final AdmissionLimiter limiter;
    private final RetryPolicy retryPolicy;
    private final boolean readOnly;
    private final LabelCache labelCache = new LabelCache();
    private final ReentrantLock labelCreationLock = new ReentrantLock();

    public GmailService(GmailGateway gateway, AdmissionLimiter limiter, RetryPolicy retryPolicy, boolean readOnly) {
        this.gateway = gateway;
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
        this.readOnly = readOnly;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public List<TargetLabel> listLabels() {
        List<Label> labels = call("listLabels", gateway::listLabels);
        List<TargetLabel> result = new ArrayList<>();
        for (Label label : labels) {
            if (label.getId() != null && label.getName() != null) {
                result.add(new TargetLabel(label.getId(), label.getName(), TargetLabel.typeOf(label.getType())));
            }
        }
        labelCache.putAll(result);
        log.debug("Label cache holds {} labels", labelCache.size());
        return result;
    }

    @Override
    public Optional<GmailMatch> findByRfc822MessageId(String rfc822MessageId) {
        String query = "rfc822msgid:" + rfc822MessageId;
        ListMessagesResponse response = call("findByRfc822MessageId", () -> gateway.listMessages(query, 1L));
        if (response == null || response.getMessages() == null || response.getMessages().isEmpty()) {
            return Optional.empty();
        }

        Message first = response.getMessages().get(0);
        String threadId = first.getThreadId();
        if (threadId == null) {
            // messages.list normally carries the thread id; fetch it when it does not
            Message full = call("getMessage", () -> gateway.getMessage(first.getId(), "minimal"));
            threadId = full.getThreadId();
        }
        return Optional.of(new GmailMatch(first.getId(), threadId, 1));
    }

    @Override
    public Optional<String> resolveLabelId(String labelName) {
        return labelCache.get(labelName).map(TargetLabel::getId);
    }

    @Override
    public TargetLabel ensureLabel(String name) {
        checkWritable("ensureLabel(" + name + ")");
        labelCreationLock.lock();
        try {
            Optional<TargetLabel> cached = labelCache.get(name);
            if (cached.isPresent()) {
                return cached.get();
            }

            Label request = new Label()
                .setName(name)
                .setLabelListVisibility("labelShow")
                .setMessageListVisibility("show");
            try {
                Label created = call("createLabel(" + name + ")", () -> gateway.createLabel(request));
                TargetLabel label = new TargetLabel(created.getId(), created.getName(), TargetLabel.Type.USER);
                labelCache.put(label);
                log.info("Created Gmail label {}", name);
                return label;
            } catch (GmailApiException e) {
                if (!e.isConflict()) {
                    throw e;
                }
                // Someone else created it between our listing and our create
                log.debug("Label {} already exists, refreshing label cache", name);
                listLabels();
                return labelCache.get(name).orElseThrow(() -> e);
            }
        } finally {
            labelCreationLock.unlock();
        }
    }

    @Override
    public Map<String, String> ensureLabels(Collection<String> names) {
        checkWritable("ensureLabels");
        listLabels();
        Map<String, String> labelIds = new LinkedHashMap<>();
        for (String name : names) {
            labelIds.put(name, ensureLabel(name).getId());
        }
        return labelIds;
    }

    @Override
    public void modifyThread(String threadId, List<String> addLabelIds, List<String> removeLabelIds) {
        checkWritable("modifyThread(" + threadId + ")");
        ModifyThreadRequest request = new ModifyThreadRequest()
            .setAddLabelIds(addLabelIds)
            .setRemoveLabelIds(removeLabelIds);
        call("modifyThread(" + threadId + ")", () -> {
            gateway.modifyThread(threadId, request);
            return null;
        });
    }

    @Override
    public void modifyMessage(String messageId, List<String> addLabelIds, List<String> removeLabelIds) {
        checkWritable("modifyMessage(" + messageId + ")");
        ModifyMessageRequest request = new ModifyMessageRequest()
            .setAddLabelIds(addLabelIds)
            .setRemoveLabelIds(removeLabelIds);
        call("modifyMessage(" + messageId + ")", () -> {
            gateway.modifyMessage(messageId, request);
            return null;
        });
    }

    @Override
    public void batchModifyMessages(List<String> messageIds, List<String> addLabelIds, List<String> removeLabelIds) {
        checkWritable("batchModifyMessages");
        if (messageIds.isEmpty()) {
            return;
        }
        for (int i = 0; i < messageIds.size(); i += MAX_BATCH_MODIFY_IDS) {
            List<String> chunk = new ArrayList<>(messageIds.subList(i, Math.min(i + MAX_BATCH_MODIFY_IDS, messageIds.size())));
            BatchModifyMessagesRequest request = new BatchModifyMessagesRequest()
                .setIds(chunk)
                .setAddLabelIds(addLabelIds)
                .setRemoveLabelIds(removeLabelIds);
            call("batchModifyMessages[" + i + ".." + (i + chunk.size()) + ")", () -> {
                gateway.batchModifyMessages(request);
                return null;
            });
        }
    }

    @Override
    public void archiveMessages(List<String> messageIds) {
        batchModifyMessages(messageIds, List.of(), List.of(INBOX_LABEL_ID));
    }

    private void checkWritable(String operation) {
        if (readOnly) {
            throw new BlockedWriteException(operation);
        }
    }

    private <T> T call(String description, GatewayCall<T> gatewayCall) {
        return retryPolicy.execute(description, () -> attempt(description, gatewayCall));
    }

    private <T> RemoteCallResult<T> attempt(String description, GatewayCall<T> gatewayCall) {
        try {
            T value = limiter.call(() -> {
                try {
                    return gatewayCall.execute();
                } catch (IOException e) {
                    throw new GatewayIOException(e);
                }
            });
            return RemoteCallResult.success(value);
        } catch (GatewayIOException e) {
            return classify(description, e.getCause());
        }
    }

    static <T> RemoteCallResult<T> classify(String description, IOException e) {
        if (e instanceof HttpResponseException) {
            HttpResponseException httpError = (HttpResponseException) e;
            int status = httpError.getStatusCode();
            String reason = reasonOf(httpError);
            if (status == 401) {
                return RemoteCallResult.fatal(new TargetAuthException(
                    "Gmail rejected the credential during " + description + ": " + httpError.getStatusMessage(), e));
            }
            GmailApiException error = new GmailApiException(
                "Gmail " + description + " failed with HTTP " + status
                    + (reason != null ? " (" + reason + ")" : "") + ": " + httpError.getStatusMessage(),
                status, reason, e);
            if (status == 429 || status >= 500 || (status == 403 && reason != null && RATE_LIMIT_REASONS.contains(reason))) {
                return RemoteCallResult.retryable(error);
            }
            return RemoteCallResult.fatal(error);
        }
        // No HTTP response at all: connection reset, timeout, DNS
        return RemoteCallResult.retryable(new GmailApiException(
            "Gmail " + description + " I/O failure: " + e.getMessage(), 0, null, e));
    }

    private static String reasonOf(HttpResponseException e) {
        if (!(e instanceof GoogleJsonResponseException)) {
            return null;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null || details.getErrors().isEmpty()) {
            return null;
        }
        return details.getErrors().get(0).getReason();
    }

    @FunctionalInterface
    private interface GatewayCall<T> {
        T execute() throws IOException;
    }

    /**
     * Carries a checked gateway failure through the limiter's Supplier.
     */
    private static final class GatewayIOException extends RuntimeException {
        GatewayIOException(IOException cause) {
            super(cause);
        }

        @Override
        public synchronized IOException getCause() {
            return (IOException) super.getCause();
        }
    }
}
