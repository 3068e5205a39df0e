package front.migrator.app.service;

import front.migrator.app.config.MigrationProperties;
import front.migrator.app.model.FrontConversation;
import front.migrator.app.model.GmailMatch;
import front.migrator.app.model.MatchMethod;
import front.migrator.app.model.MigrationAction;
import front.migrator.app.model.MigrationItem;
import front.migrator.app.model.MigrationResult;
import front.migrator.app.model.MigrationStatistics;
import front.migrator.app.model.ReportRow;
import front.migrator.app.support.Batches;
import front.migrator.app.support.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one migration: fetch Front conversations, map them, make sure every Gmail label exists,
 * then match and label each conversation's Gmail thread, batch by batch, and write the report.
 *
 * Items are handled strictly one after another on the calling thread. The only concurrency is
 * inside the clients' admission limiters.
 */
@Slf4j
@Service
public class MigrationService {
    public static final String REASON_MISSING_IDENTIFIER = "missing identifier";
    public static final String REASON_SKIP_ARCHIVED = "skip_archived=true";

    private final FrontApiService frontApiService;
    private final ConversationMapper conversationMapper;
    private final TargetAccess targetAccess;
    private final MigrationProperties properties;
    private final ReportWriter reportWriter;
    private final MigrationProgressListener progressListener;
    private final Sleeper sleeper;

    public MigrationService(
            FrontApiService frontApiService,
            ConversationMapper conversationMapper,
            TargetAccess targetAccess,
            MigrationProperties properties,
            ReportWriter reportWriter,
            MigrationProgressListener progressListener,
            Sleeper sleeper) {
        if (properties.isDryRun() != targetAccess.isReadOnly()) {
            throw new IllegalStateException("Dry run requires read-only Gmail access and a live run requires write access"
                + " (dryRun=" + properties.isDryRun() + ", readOnly=" + targetAccess.isReadOnly() + ")");
        }
        this.frontApiService = frontApiService;
        this.conversationMapper = conversationMapper;
        this.targetAccess = targetAccess;
        this.properties = properties;
        this.reportWriter = reportWriter;
        this.progressListener = progressListener;
        this.sleeper = sleeper;
    }

    /**
     * Execute the whole migration once.
     * Item-level failures end up as {@code failed} report rows. Run-level failures (authentication,
     * label reconciliation, interruption) are rethrown after the rows gathered so far are written.
     */
    public MigrationResult run() {
        boolean dryRun = targetAccess.isReadOnly();
        MigrationStatistics stats = new MigrationStatistics();
        List<ReportRow> report = new ArrayList<>();

        try {
            log.info("Fetching conversations from Front...");
            String inboxId = properties.hasInboxFilter() ? properties.getInboxId() : null;
            List<MigrationItem> items = frontApiService.streamConversations(inboxId)
                .map(this::withMessages)
                .map(conversationMapper::map)
                .collect(Collectors.toList());
            stats.setTotal(items.size());
            log.info("Found {} conversations in Front", items.size());

            reconcileLabels(items);

            log.info("Starting migration...");
            if (dryRun) {
                log.warn("DRY RUN MODE - No changes will be made to Gmail");
            }

            List<List<MigrationItem>> batches = Batches.partition(items, properties.getBatchSize());
            for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
                log.info("Processing batch {}/{}...", batchIndex + 1, batches.size());
                for (MigrationItem item : batches.get(batchIndex)) {
                    report.add(processItem(item, stats));
                    stats.incrementProcessed();
                    publishProgress(stats);
                }

                // Deliberate pause between batches to stay under the Gmail rate limits
                if (batchIndex < batches.size() - 1) {
                    pauseBetweenBatches();
                }
            }
        } catch (RuntimeException e) {
            log.error("Migration failed after {} of {} conversations: {}",
                stats.getProcessed(), stats.getTotal(), e.getMessage(), e);
            writeReport(report);
            throw e;
        }

        logSummary(stats, dryRun);
        Path reportPath = writeReport(report);
        return new MigrationResult(dryRun, stats.snapshot(), List.copyOf(report), reportPath);
    }

    /**
     * Conversation pages can arrive without embedded messages; the Message-ID lives on the messages,
     * so fetch them before mapping. A failed fetch leaves the conversation as it came.
     */
    private FrontConversation withMessages(FrontConversation conversation) {
        if (conversation.getMessages() != null && !conversation.getMessages().isEmpty()) {
            return conversation;
        }
        try {
            log.debug("Fetching messages of conversation {}", conversation.getId());
            conversation.setMessages(frontApiService.listConversationMessages(conversation.getId()));
        } catch (FrontApiService.FrontApiException e) {
            log.warn("Could not fetch messages of conversation {}: {}", conversation.getId(), e.getMessage());
        }
        return conversation;
    }

    /**
     * Every tag label plus both status labels must exist before the first thread is touched.
     * A dry run only reports what it would create.
     */
    void reconcileLabels(List<MigrationItem> items) {
        Set<String> required = requiredLabels(items);
        Optional<GmailWriter> writer = targetAccess.writer();
        if (writer.isEmpty()) {
            log.info("[DRY RUN] Would create/verify {} labels in Gmail: {}", required.size(), String.join(", ", required));
            return;
        }

        log.info("Creating/verifying {} labels in Gmail...", required.size());
        try {
            Map<String, String> labelIds = writer.get().ensureLabels(required);
            log.info("Labels ready: {}", String.join(", ", labelIds.keySet()));
        } catch (GmailReader.TargetAuthException | GmailWriter.BlockedWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LabelReconciliationException("Could not create or verify Gmail labels: " + e.getMessage(), e);
        }
    }

    static Set<String> requiredLabels(List<MigrationItem> items) {
        Set<String> required = new LinkedHashSet<>();
        items.forEach(item -> required.addAll(item.getLabels()));
        required.add(ConversationMapper.STATUS_LABEL_ARCHIVED);
        required.add(ConversationMapper.STATUS_LABEL_INBOX);
        return required;
    }

    /**
     * Decide and, in a live run, apply the outcome for one conversation.
     * The first matching state wins: missing Message-ID, archived and filtered, no Gmail match, matched.
     */
    ReportRow processItem(MigrationItem item, MigrationStatistics stats) {
        Optional<String> rfc822MessageId = item.getRfc822MessageId();
        if (rfc822MessageId.isEmpty()) {
            log.debug("Skipping (missing Message-ID): {}", item.getSubject());
            stats.incrementSkipped();
            return ReportRow.forItem(item)
                .action(MigrationAction.SKIPPED)
                .reason(REASON_MISSING_IDENTIFIER)
                .build();
        }

        if (properties.isSkipArchived() && item.isArchived()) {
            log.debug("Skipping archived conversation: {}", item.getSubject());
            stats.incrementSkipped();
            return ReportRow.forItem(item)
                .action(MigrationAction.SKIPPED)
                .reason(REASON_SKIP_ARCHIVED)
                .build();
        }

        try {
            log.debug("Looking up Gmail by Message-ID: {}", rfc822MessageId.get());
            Optional<GmailMatch> lookup = targetAccess.reader().findByRfc822MessageId(rfc822MessageId.get());
            if (lookup.isEmpty()) {
                log.debug("No Gmail match found for: {}", item.getSubject());
                stats.incrementUnmatched();
                return ReportRow.forItem(item)
                    .matchMethod(MatchMethod.MESSAGE_ID)
                    .gmailResults(0)
                    .action(MigrationAction.NO_MATCH)
                    .build();
            }

            GmailMatch match = lookup.get();
            stats.incrementMatched();
            log.debug("Found Gmail message {} (thread {}) for Front conversation {}",
                match.getMessageId(), match.getThreadId(), item.getFrontConversationId());

            List<String> labelsToAdd = labelsToAdd(item);
            List<String> labelsToRemove = List.of(ConversationMapper.oppositeStatusLabel(item.isArchived()));
            ReportRow.ReportRowBuilder row = ReportRow.forItem(item)
                .matchMethod(MatchMethod.MESSAGE_ID)
                .gmailResults(match.getResultCount())
                .gmailMessageId(match.getMessageId())
                .threadId(match.getThreadId())
                .labelsToAdd(labelsToAdd)
                .labelsToRemove(labelsToRemove);

            Optional<GmailWriter> writer = targetAccess.writer();
            if (writer.isEmpty()) {
                log.info("[DRY RUN] Would update thread {}: add [{}], remove [{}]",
                    match.getThreadId(), String.join(", ", labelsToAdd), String.join(", ", labelsToRemove));
                return row.action(MigrationAction.DRY_RUN).build();
            }

            List<String> addLabelIds = resolveLabelIds(labelsToAdd);
            List<String> removeLabelIds = resolveLabelIds(labelsToRemove);
            writer.get().modifyThread(match.getThreadId(), addLabelIds, removeLabelIds);
            stats.addLabeled(addLabelIds.size());
            stats.incrementStatus(item.isArchived());
            log.debug("Applied {} labels to thread {} (removed opposite status label if present)",
                addLabelIds.size(), match.getThreadId());
            return row.action(MigrationAction.APPLIED).build();

        } catch (GmailReader.TargetAuthException | GmailWriter.BlockedWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                // Stop after this item instead of failing every remaining one
                throw e;
            }
            log.error("Failed to process item: {} ({})", item.getSubject(), item.getFrontConversationId(), e);
            stats.incrementFailed();
            return ReportRow.forItem(item)
                .action(MigrationAction.FAILED)
                .reason(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                .build();
        }
    }

    private static List<String> labelsToAdd(MigrationItem item) {
        Set<String> labels = new LinkedHashSet<>(item.getLabels());
        labels.add(ConversationMapper.statusLabel(item.isArchived()));
        return List.copyOf(labels);
    }

    private List<String> resolveLabelIds(Collection<String> labelNames) {
        List<String> ids = new ArrayList<>();
        for (String name : labelNames) {
            Optional<String> id = targetAccess.reader().resolveLabelId(name);
            if (id.isPresent()) {
                ids.add(id.get());
            } else {
                log.warn("No Gmail label id cached for '{}', leaving it out", name);
            }
        }
        return ids;
    }

    private void pauseBetweenBatches() {
        try {
            sleeper.sleep(properties.getBatchDelay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Migration interrupted between batches", e);
        }
    }

    private void publishProgress(MigrationStatistics stats) {
        try {
            progressListener.onItemProcessed(stats.snapshot());
        } catch (RuntimeException e) {
            log.warn("Progress listener failed: {}", e.getMessage());
        }
    }

    private Path writeReport(List<ReportRow> report) {
        try {
            return reportWriter.write(report);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write CSV report: {}", e.getMessage(), e);
            return null;
        }
    }

    private void logSummary(MigrationStatistics stats, boolean dryRun) {
        log.info("============================================================");
        log.info("MIGRATION SUMMARY");
        log.info("============================================================");
        log.info("Total conversations:      {}", stats.getTotal());
        log.info("Processed:                {}", stats.getProcessed());
        log.info("Matched in Gmail:         {}", stats.getMatched());
        log.info("Not found in Gmail:       {}", stats.getUnmatched());
        log.info("Labels applied:           {}", stats.getLabeled());
        log.info("Status labeled (Arch/In): {}/{}", stats.getStatusArchived(), stats.getStatusInbox());
        log.info("Skipped:                  {}", stats.getSkipped());
        log.info("Failed:                   {}", stats.getFailed());
        log.info("============================================================");
        if (dryRun) {
            log.info("This was a DRY RUN - no changes were made to Gmail. Set DRY_RUN=false to perform the migration.");
        }
    }
}
