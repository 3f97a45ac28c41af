package com.threadmail.domain;

import com.threadmail.domain.InvariantViolationException.Violation;
import com.threadmail.domain.event.MessageAdded;
import com.threadmail.domain.event.MessageFlagged;
import com.threadmail.domain.event.MessageLabelAdded;
import com.threadmail.domain.event.MessageMarkedRead;
import com.threadmail.domain.event.MessageRemoved;
import com.threadmail.domain.event.ThreadArchived;
import com.threadmail.domain.event.ThreadCreated;
import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.domain.event.ThreadMarkedRead;
import com.threadmail.domain.event.ThreadUnarchived;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.threadmail.domain.MailFixtures.CLOCK;
import static com.threadmail.domain.MailFixtures.NOW;
import static com.threadmail.domain.MailFixtures.SENT_AT;
import static com.threadmail.domain.MailFixtures.externalId;
import static com.threadmail.domain.MailFixtures.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MailThread aggregate unit tests
 */
class MailThreadTest {

    private static MailThread kickoffThread() {
        MailThread thread = MailThread.create("t1", message("m1", "Project Kickoff").build(), CLOCK);
        thread.clearUncommittedEvents();
        return thread;
    }

    private static void assertViolation(Runnable operation, Violation expected) {
        assertThatThrownBy(operation::run)
                .isInstanceOfSatisfying(InvariantViolationException.class,
                        e -> assertThat(e.getViolation()).isEqualTo(expected));
    }

    @Test
    @DisplayName("Create emits ThreadCreated at version 1")
    void testCreate() {
        MailMessage founding = message("m1", "Project Kickoff").build();

        MailThread thread = MailThread.create("t1", founding, CLOCK);

        assertThat(thread.getVersion()).isEqualTo(1);
        assertThat(thread.getSubject()).isEqualTo(new Subject("Project Kickoff"));
        assertThat(thread.getMessages()).containsExactly(founding);
        assertThat(thread.getParticipants()).containsExactlyInAnyOrder("alice@example.com", "bob@example.com");
        assertThat(thread.getLastActivityAt()).isEqualTo(SENT_AT);
        assertThat(thread.isArchived()).isFalse();
        assertThat(thread.isMuted()).isFalse();
        assertThat(thread.getUncommittedEvents()).singleElement()
                .isInstanceOfSatisfying(ThreadCreated.class, e -> {
                    assertThat(e.threadId()).isEqualTo("t1");
                    assertThat(e.version()).isEqualTo(1);
                    assertThat(e.occurredAt()).isEqualTo(NOW);
                    assertThat(e.eventData()).containsEntry("initialMessageId", "m1");
                });
    }

    @Test
    @DisplayName("Reply with matching subject and In-Reply-To is added (version 2)")
    void testAddReply() {
        MailThread thread = kickoffThread();
        MailMessage reply = message("m2", "Re: Project Kickoff")
                .from(new EmailAddress("bob@example.com"))
                .to(List.of(new EmailAddress("alice@example.com")))
                .cc(List.of(new EmailAddress("carol@example.com")))
                .sentAt(SENT_AT.plusSeconds(60))
                .inReplyTo(externalId("m1"))
                .build();

        thread.addMessage(reply);

        assertThat(thread.getVersion()).isEqualTo(2);
        assertThat(thread.getMessageCount()).isEqualTo(2);
        assertThat(thread.getLatestMessage()).isEqualTo(reply);
        assertThat(thread.getParticipants()).contains("carol@example.com");
        assertThat(thread.getLastActivityAt()).isEqualTo(NOW);
        assertThat(thread.getUncommittedEvents()).singleElement().isInstanceOf(MessageAdded.class);
    }

    @Test
    @DisplayName("Unrelated message is rejected and nothing changes")
    void testAddUnrelated() {
        MailThread thread = kickoffThread();

        assertViolation(() -> thread.addMessage(message("m2", "Lunch plans").build()), Violation.NOT_PART_OF_THREAD);

        assertThat(thread.getVersion()).isEqualTo(1);
        assertThat(thread.getMessageCount()).isEqualTo(1);
        assertThat(thread.hasUncommittedEvents()).isFalse();
    }

    @Test
    @DisplayName("Same message id cannot be added twice")
    void testAddDuplicate() {
        MailThread thread = kickoffThread();

        assertViolation(() -> thread.addMessage(message("m1", "Re: Project Kickoff").build()),
                Violation.DUPLICATE_MESSAGE);
        assertThat(thread.getVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("Last remaining message cannot be removed")
    void testRemoveLastMessage() {
        MailThread thread = kickoffThread();

        assertViolation(() -> thread.removeMessage("m1"), Violation.LAST_MESSAGE_PROTECTED);
        assertThat(thread.getVersion()).isEqualTo(1);
        assertThat(thread.getMessageCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Removing a message recomputes participants")
    void testRemoveMessage() {
        MailThread thread = kickoffThread();
        thread.addMessage(message("m2", "Re: Project Kickoff")
                .to(List.of(new EmailAddress("carol@example.com")))
                .build());

        thread.removeMessage("m2");

        assertThat(thread.getVersion()).isEqualTo(3);
        assertThat(thread.containsMessage("m2")).isFalse();
        assertThat(thread.getParticipants()).containsExactlyInAnyOrder("alice@example.com", "bob@example.com");
        assertThat(thread.getUncommittedEvents()).last().isInstanceOf(MessageRemoved.class);
    }

    @Test
    @DisplayName("Removing an unknown message is rejected")
    void testRemoveUnknown() {
        MailThread thread = kickoffThread();

        assertViolation(() -> thread.removeMessage("nope"), Violation.MESSAGE_NOT_FOUND);
    }

    @Test
    @DisplayName("Mark all read emits one event listing every unread message; a second call is a no-op")
    void testMarkAllRead() {
        MailThread thread = kickoffThread();
        thread.addMessage(message("m2", "Re: Project Kickoff").sentAt(SENT_AT.plusSeconds(1)).build());
        thread.addMessage(message("m3", "Re: Project Kickoff").sentAt(SENT_AT.plusSeconds(2)).build());
        thread.clearUncommittedEvents();

        thread.markAllRead();

        assertThat(thread.getVersion()).isEqualTo(4);
        assertThat(thread.hasUnreadMessages()).isFalse();
        assertThat(thread.getMessages()).allMatch(MailMessage::isRead);
        assertThat(thread.getUncommittedEvents()).singleElement()
                .isInstanceOfSatisfying(ThreadMarkedRead.class,
                        e -> assertThat(e.messageIds()).containsExactly("m1", "m2", "m3"));

        thread.markAllRead();

        assertThat(thread.getVersion()).isEqualTo(4);
        assertThat(thread.getUncommittedEvents()).hasSize(1);
    }

    @Test
    @DisplayName("Archive, unarchive, archive each advance the version; a repeated archive fails")
    void testArchiveCycle() {
        MailThread thread = kickoffThread();

        thread.archive();
        thread.unarchive();
        thread.archive();

        assertThat(thread.getVersion()).isEqualTo(4);
        assertThat(thread.isArchived()).isTrue();
        assertThat(thread.getUncommittedEvents()).extracting(ThreadEvent::eventName)
                .containsExactly(ThreadArchived.NAME, ThreadUnarchived.NAME, ThreadArchived.NAME);

        assertViolation(thread::archive, Violation.ALREADY_IN_STATE);
        assertThat(thread.getVersion()).isEqualTo(4);
    }

    @Test
    @DisplayName("Mute toggles do not touch last activity")
    void testMute() {
        MailThread thread = kickoffThread();
        Instant before = thread.getLastActivityAt();

        thread.mute();
        assertViolation(thread::mute, Violation.ALREADY_IN_STATE);
        thread.unmute();
        assertViolation(thread::unmute, Violation.ALREADY_IN_STATE);

        assertThat(thread.isMuted()).isFalse();
        assertThat(thread.getVersion()).isEqualTo(3);
        assertThat(thread.getLastActivityAt()).isEqualTo(before);
    }

    @Test
    @DisplayName("Per-message read, flag and label operations")
    void testPerMessageOperations() {
        MailThread thread = kickoffThread();

        thread.markMessageRead("m1");
        thread.flagMessage("m1");
        thread.addLabel("m1", " Work ");

        MailMessage message = thread.getMessage("m1").orElseThrow();
        assertThat(message.isRead()).isTrue();
        assertThat(message.isFlagged()).isTrue();
        assertThat(message.getLabels()).containsExactly("work");
        assertThat(thread.getUncommittedEvents()).hasExactlyElementsOfTypes(
                MessageMarkedRead.class, MessageFlagged.class, MessageLabelAdded.class);

        assertViolation(() -> thread.markMessageRead("m1"), Violation.ALREADY_IN_STATE);
        assertViolation(() -> thread.flagMessage("m1"), Violation.ALREADY_IN_STATE);
        assertViolation(() -> thread.addLabel("m1", "WORK"), Violation.ALREADY_IN_STATE);
        assertViolation(() -> thread.removeLabel("m1", "personal"), Violation.ALREADY_IN_STATE);
        assertViolation(() -> thread.flagMessage("nope"), Violation.MESSAGE_NOT_FOUND);

        thread.markMessageUnread("m1");
        thread.unflagMessage("m1");
        thread.removeLabel("m1", "work");

        MailMessage reverted = thread.getMessage("m1").orElseThrow();
        assertThat(reverted.isRead()).isFalse();
        assertThat(reverted.isFlagged()).isFalse();
        assertThat(reverted.getLabels()).isEmpty();
        assertThat(thread.getVersion()).isEqualTo(7);
        assertThat(thread.getUnreadCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Messages are listed by sent time regardless of arrival order")
    void testChronologicalOrder() {
        MailThread thread = MailThread.create("t1",
                message("m1", "Budget").sentAt(SENT_AT.plusSeconds(100)).build(), CLOCK);
        thread.addMessage(message("m2", "Re: Budget").sentAt(SENT_AT).build());

        assertThat(thread.getMessages()).extracting(MailMessage::getId).containsExactly("m2", "m1");
        assertThat(thread.getLatestMessage().getId()).isEqualTo("m1");
    }

    @Test
    @DisplayName("Restore rebuilds a snapshot without events")
    void testRestore() {
        MailMessage m1 = message("m1", "Budget").read(true).build();

        MailThread thread = MailThread.restore("t1", new Subject("Budget"), List.of(m1),
                true, false, SENT_AT, 5, CLOCK);

        assertThat(thread.getVersion()).isEqualTo(5);
        assertThat(thread.isArchived()).isTrue();
        assertThat(thread.hasUncommittedEvents()).isFalse();
        assertThat(thread.getParticipants()).hasSize(2);

        thread.unarchive();
        assertThat(thread.getUncommittedEvents()).singleElement()
                .extracting(ThreadEvent::version).isEqualTo(6L);
    }

    @Test
    @DisplayName("Restore rejects a snapshot without messages")
    void testRestoreEmpty() {
        assertThatThrownBy(() -> MailThread.restore("t1", new Subject("Budget"), List.of(),
                false, false, SENT_AT, 1, CLOCK))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
