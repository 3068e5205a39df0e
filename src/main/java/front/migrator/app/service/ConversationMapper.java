package front.migrator.app.service;

import front.migrator.app.model.FrontConversation;
import front.migrator.app.model.FrontMessage;
import front.migrator.app.model.FrontRecipient;
import front.migrator.app.model.FrontTag;
import front.migrator.app.model.MigrationItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns Front conversations into {@link MigrationItem}s. No I/O.
 */
@Slf4j
@Component
public class ConversationMapper {
    public static final String LABEL_NAMESPACE = "Front/";
    public static final String RESERVED_PREFIX = "Front-";
    public static final String STATUS_LABEL_ARCHIVED = "Front/Status/Archived";
    public static final String STATUS_LABEL_INBOX = "Front/Status/Inbox";
    public static final String NO_SUBJECT = "(no subject)";

    // Gmail system label names a user label may not take
    // IMPORTANT is left out: a nested Front/Important never shadows the system label
    static final Set<String> RESERVED_LABELS = Set.of(
        "INBOX", "SPAM", "TRASH", "UNREAD", "STARRED", "SENT", "DRAFT");

    public MigrationItem map(FrontConversation conversation) {
        MigrationItem.MigrationItemBuilder item = MigrationItem.builder()
            .frontConversationId(conversation.getId())
            .subject(conversation.getSubject() == null || conversation.getSubject().isEmpty()
                ? NO_SUBJECT : conversation.getSubject())
            .archived(FrontConversation.STATUS_ARCHIVED.equals(conversation.getStatus()))
            .createdAt(toInstant(conversation.getCreatedAt()));

        if (conversation.getTags() != null) {
            for (FrontTag tag : conversation.getTags()) {
                if (tag != null && tag.getName() != null) {
                    Optional<String> label = sanitizeLabel(tag.getName());
                    if (label.isPresent()) {
                        item.label(label.get());
                    } else {
                        log.warn("Ignoring tag '{}' on conversation {}: nothing left after sanitizing",
                            tag.getName(), conversation.getId());
                    }
                }
            }
        }

        List<FrontMessage> messages = conversation.getMessages() == null ? List.of() : conversation.getMessages();
        item.participantAddresses(participantAddresses(messages));
        item.rfc822MessageId(extractMessageId(messages));
        return item.build();
    }

    /**
     * Makes a Front tag name usable as a nested Gmail user label.
     * Applying it to its own output returns the same name.
     *
     * @return the nested label, or empty when the name held nothing but markers and whitespace
     */
    public static Optional<String> sanitizeLabel(String name) {
        String leaf = name.startsWith(LABEL_NAMESPACE) ? name.substring(LABEL_NAMESPACE.length()) : name;
        leaf = leaf.replaceAll("[/\\\\]", "-")
            .replaceAll("^[\\x00-\\x20^]+", "")
            .trim();
        if (leaf.isEmpty()) {
            return Optional.empty();
        }

        if (RESERVED_LABELS.contains(leaf.toUpperCase(Locale.ROOT))) {
            leaf = RESERVED_PREFIX + leaf;
        }
        return Optional.of(LABEL_NAMESPACE + leaf);
    }

    public static String statusLabel(boolean archived) {
        return archived ? STATUS_LABEL_ARCHIVED : STATUS_LABEL_INBOX;
    }

    public static String oppositeStatusLabel(boolean archived) {
        return archived ? STATUS_LABEL_INBOX : STATUS_LABEL_ARCHIVED;
    }

    /**
     * First Message-ID header of an email message, with one surrounding angle-bracket pair removed.
     * Null when no email message carries one; never guessed.
     */
    static String extractMessageId(List<FrontMessage> messages) {
        for (FrontMessage message : messages) {
            if (message == null || !message.isEmail()) {
                continue;
            }
            String header = message.header(FrontMessage.HEADER_MESSAGE_ID);
            if (header == null || header.isBlank()) {
                continue;
            }
            String cleaned = header.trim();
            if (cleaned.startsWith("<")) {
                cleaned = cleaned.substring(1);
            }
            if (cleaned.endsWith(">")) {
                cleaned = cleaned.substring(0, cleaned.length() - 1);
            }
            return cleaned.isEmpty() ? null : cleaned;
        }
        return null;
    }

    private static Set<String> participantAddresses(List<FrontMessage> messages) {
        Set<String> addresses = new LinkedHashSet<>();
        for (FrontMessage message : messages) {
            if (message == null || !message.isEmail()) {
                continue;
            }
            addHandle(addresses, message.getFrom());
            if (message.getRecipients() != null) {
                message.getRecipients().forEach(recipient -> addHandle(addresses, recipient));
            }
        }
        return addresses;
    }

    private static void addHandle(Set<String> addresses, FrontRecipient recipient) {
        if (recipient != null && recipient.getHandle() != null && !recipient.getHandle().isBlank()) {
            addresses.add(recipient.getHandle());
        }
    }

    private static Instant toInstant(Double epochSeconds) {
        if (epochSeconds == null) {
            return Instant.EPOCH;
        }
        long millis = Math.round(epochSeconds * 1000d);
        return Instant.ofEpochMilli(millis);
    }
}
