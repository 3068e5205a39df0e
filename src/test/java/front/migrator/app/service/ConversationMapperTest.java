package front.migrator.app.service;

import front.migrator.app.model.FrontConversation;
import front.migrator.app.model.FrontMessage;
import front.migrator.app.model.FrontRecipient;
import front.migrator.app.model.FrontTag;
import front.migrator.app.model.MigrationItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConversationMapperTest {

    private ConversationMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ConversationMapper();
    }

    static FrontMessage emailMessage(String messageIdHeader, String from, String... to) {
        FrontMessage message = new FrontMessage();
        message.setType(FrontMessage.TYPE_EMAIL);
        message.setFrom(new FrontRecipient(from, null, "from"));
        List<FrontRecipient> recipients = new ArrayList<>();
        for (String handle : to) {
            recipients.add(new FrontRecipient(handle, null, "to"));
        }
        message.setRecipients(recipients);
        if (messageIdHeader != null) {
            FrontMessage.Metadata metadata = new FrontMessage.Metadata();
            metadata.setHeaders(Map.of("message-id", messageIdHeader));
            message.setMetadata(metadata);
        }
        return message;
    }

    static FrontConversation conversation(String id, String status, List<String> tags, FrontMessage... messages) {
        FrontConversation conversation = new FrontConversation();
        conversation.setId(id);
        conversation.setSubject("Subject " + id);
        conversation.setStatus(status);
        List<FrontTag> frontTags = new ArrayList<>();
        for (String tag : tags) {
            frontTags.add(new FrontTag("tag_" + tag, tag));
        }
        conversation.setTags(frontTags);
        conversation.setMessages(new ArrayList<>(List.of(messages)));
        conversation.setCreatedAt(1700000000.5);
        return conversation;
    }

    @Test
    void map_WithArchivedConversation_ShouldCarryLabelsFlagAndCleanMessageId() {
        // Given
        FrontConversation conversation = conversation("cnv_1", "archived", List.of("Important"),
            emailMessage("<abc@mail.example.com>", "alice@example.com", "bob@example.com"));

        // When
        MigrationItem item = mapper.map(conversation);

        // Then
        assertEquals("cnv_1", item.getFrontConversationId());
        assertTrue(item.isArchived());
        assertEquals(List.of("Front/Important"), item.getLabels());
        assertEquals("abc@mail.example.com", item.getRfc822MessageId().orElseThrow());
        assertEquals(Instant.ofEpochMilli(1700000000500L), item.getCreatedAt());
    }

    @ParameterizedTest
    @ValueSource(strings = {"unassigned", "assigned", "deleted", "spam", "ARCHIVED", "Archived", "snoozed", ""})
    void map_WithAnyStatusOtherThanArchived_ShouldNotBeArchived(String status) {
        // When
        MigrationItem item = mapper.map(conversation("cnv_2", status, List.of()));

        // Then
        assertFalse(item.isArchived());
    }

    @Test
    void map_WithNoEmailMessages_ShouldLeaveIdentifierUnset() {
        // Given
        FrontMessage sms = emailMessage("<should-not-be-used@example.com>", "+15550100");
        sms.setType("sms");

        // When
        MigrationItem item = mapper.map(conversation("cnv_3", "archived", List.of("VIP"), sms));

        // Then
        assertTrue(item.getRfc822MessageId().isEmpty());
        assertTrue(item.getParticipantAddresses().isEmpty());
    }

    @Test
    void map_ShouldUseFirstEmailMessageCarryingMessageId() {
        // Given
        FrontMessage withoutHeader = emailMessage(null, "a@example.com");
        FrontMessage first = emailMessage("<first@example.com>", "b@example.com", "a@example.com");
        FrontMessage second = emailMessage("<second@example.com>", "c@example.com");

        // When
        MigrationItem item = mapper.map(conversation("cnv_4", "unassigned", List.of(), withoutHeader, first, second));

        // Then
        assertEquals("first@example.com", item.getRfc822MessageId().orElseThrow());
        assertEquals(List.of("a@example.com", "b@example.com", "c@example.com"),
            new ArrayList<>(item.getParticipantAddresses()));
    }

    @Test
    void map_WithHeaderWithoutBrackets_ShouldKeepItAsIs() {
        // When
        MigrationItem item = mapper.map(conversation("cnv_5", "archived", List.of(),
            emailMessage("plain-id@example.com", "a@example.com")));

        // Then
        assertEquals("plain-id@example.com", item.getRfc822MessageId().orElseThrow());
    }

    @Test
    void map_WithEmptySubject_ShouldUsePlaceholder() {
        // Given
        FrontConversation conversation = conversation("cnv_6", "archived", List.of());
        conversation.setSubject("");

        // When
        MigrationItem item = mapper.map(conversation);

        // Then
        assertEquals(ConversationMapper.NO_SUBJECT, item.getSubject());
    }

    @Test
    void sanitizeLabel_WithReservedInbox_ShouldUseReservedPrefixedForm() {
        // When
        String sanitized = ConversationMapper.sanitizeLabel("INBOX").orElseThrow();

        // Then
        assertEquals("Front/Front-INBOX", sanitized);
        assertNotEquals("Front/INBOX", sanitized);
    }

    @Test
    void sanitizeLabel_ShouldReplaceDelimitersAndStripLeadingCaret() {
        assertEquals("Front/Sales-EMEA", ConversationMapper.sanitizeLabel("Sales/EMEA").orElseThrow());
        assertEquals("Front/a-b", ConversationMapper.sanitizeLabel("a\\b").orElseThrow());
        assertEquals("Front/Urgent", ConversationMapper.sanitizeLabel("^Urgent").orElseThrow());
        assertEquals("Front/Billing", ConversationMapper.sanitizeLabel("Front/Billing").orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Important", "INBOX", "inbox", "Sales/EMEA", "^Urgent", "^^Twice", "  ^ spaced  ",
        "Front/Billing", "Front/Front/x", "a\\b/c", "Front-INBOX", "\u0001^ctl", "trailing/"})
    void sanitizeLabel_ShouldBeIdempotent(String name) {
        // When
        String once = ConversationMapper.sanitizeLabel(name).orElseThrow();

        // Then
        assertEquals(Optional.of(once), ConversationMapper.sanitizeLabel(once));
    }

    @ParameterizedTest
    @ValueSource(strings = {"INBOX", "SPAM", "TRASH", "UNREAD", "STARRED", "SENT", "DRAFT"})
    void sanitizeLabel_WithReservedWordInAnyCase_ShouldNeverCollideWithSystemLabel(String reserved) {
        for (String variant : List.of(reserved, reserved.toLowerCase(Locale.ROOT),
                reserved.charAt(0) + reserved.substring(1).toLowerCase(Locale.ROOT))) {
            // When
            String sanitized = ConversationMapper.sanitizeLabel(variant).orElseThrow();

            // Then
            assertFalse(ConversationMapper.RESERVED_LABELS.contains(sanitized.toUpperCase(Locale.ROOT)));
            assertEquals("Front/Front-" + variant, sanitized);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"^", "   ", "^^ ", "", "Front/", "Front/^", "\u0002"})
    void sanitizeLabel_WithNothingLeftAfterStripping_ShouldBeEmpty(String name) {
        assertEquals(Optional.empty(), ConversationMapper.sanitizeLabel(name));
    }

    @Test
    void map_WithMarkerOnlyTags_ShouldDropThemAndKeepTheRest() {
        // Given
        FrontConversation conversation = conversation("cnv_9", "open", List.of("^", "   ", "Billing"),
            emailMessage("<tags@example.com>", "alice@example.com"));

        // When
        MigrationItem item = mapper.map(conversation);

        // Then
        assertEquals(List.of("Front/Billing"), item.getLabels());
        assertFalse(MigrationService.requiredLabels(List.of(item)).contains(ConversationMapper.LABEL_NAMESPACE));
    }

    @Test
    void statusLabels_ShouldBeMutuallyExclusive() {
        assertEquals(ConversationMapper.STATUS_LABEL_ARCHIVED, ConversationMapper.statusLabel(true));
        assertEquals(ConversationMapper.STATUS_LABEL_INBOX, ConversationMapper.oppositeStatusLabel(true));
        assertEquals(ConversationMapper.STATUS_LABEL_INBOX, ConversationMapper.statusLabel(false));
        assertEquals(ConversationMapper.STATUS_LABEL_ARCHIVED, ConversationMapper.oppositeStatusLabel(false));
    }
}
