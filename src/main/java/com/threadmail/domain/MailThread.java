package com.threadmail.domain;

import com.threadmail.domain.InvariantViolationException.Violation;
import com.threadmail.domain.event.MessageAdded;
import com.threadmail.domain.event.MessageFlagged;
import com.threadmail.domain.event.MessageLabelAdded;
import com.threadmail.domain.event.MessageLabelRemoved;
import com.threadmail.domain.event.MessageMarkedRead;
import com.threadmail.domain.event.MessageMarkedUnread;
import com.threadmail.domain.event.MessageRemoved;
import com.threadmail.domain.event.MessageUnflagged;
import com.threadmail.domain.event.ThreadArchived;
import com.threadmail.domain.event.ThreadCreated;
import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.domain.event.ThreadMarkedRead;
import com.threadmail.domain.event.ThreadMuted;
import com.threadmail.domain.event.ThreadUnarchived;
import com.threadmail.domain.event.ThreadUnmuted;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Email thread aggregate root.
 *
 * <p>Owns its messages and is the only place they change. Every accepted
 * operation produces exactly one {@link ThreadEvent} and bumps the version by
 * one; a rejected operation throws before anything is touched. State changes
 * are made only by {@link #apply}, which is also what {@link #replay} runs, so
 * a thread rebuilt from its event log matches the original.
 *
 * <p>Not thread-safe. Callers serialize mutations per thread id.
 */
public final class MailThread {

    private static final Comparator<MailMessage> CHRONOLOGICAL =
            Comparator.comparing(MailMessage::getSentAt).thenComparing(MailMessage::getId);

    @Getter
    private final String id;
    private final Clock clock;
    private final EventRecorder<ThreadEvent> recorder;
    private final Map<String, MailMessage> messages = new LinkedHashMap<>();
    private final Set<String> participants = new LinkedHashSet<>();

    @Getter
    private Subject subject;
    @Getter
    private boolean archived;
    @Getter
    private boolean muted;
    @Getter
    private Instant lastActivityAt;

    private MailThread(String id, Clock clock, long version) {
        this.id = id;
        this.clock = clock;
        this.recorder = new EventRecorder<>(version);
    }

    // ---- Factories ----

    public static MailThread create(String id, MailMessage foundingMessage) {
        return create(id, foundingMessage, Clock.systemUTC());
    }

    /**
     * Start a thread from its founding message. Emits {@link ThreadCreated}, version 1.
     */
    public static MailThread create(String id, MailMessage foundingMessage, Clock clock) {
        if (id == null || id.isBlank()) {
            throw new InvalidValueException("Thread id is required");
        }
        if (foundingMessage == null) {
            throw new InvalidValueException("Founding message is required");
        }
        MailThread thread = new MailThread(id, clock, 0L);
        thread.raise(new ThreadCreated(id, thread.recorder.nextVersion(), clock.instant(),
                foundingMessage.getSubject(), foundingMessage));
        return thread;
    }

    public static MailThread replay(List<? extends ThreadEvent> history) {
        return replay(history, Clock.systemUTC());
    }

    /**
     * Rebuild a thread from its ordered event log, starting at version 1.
     * The result has no uncommitted events.
     */
    public static MailThread replay(List<? extends ThreadEvent> history, Clock clock) {
        if (history == null || history.isEmpty()) {
            throw new IllegalArgumentException("Cannot replay an empty event log");
        }
        if (!(history.get(0) instanceof ThreadCreated created)) {
            throw new IllegalArgumentException("Event log must start with " + ThreadCreated.NAME
                    + " but starts with " + history.get(0).eventName());
        }
        MailThread thread = new MailThread(created.threadId(), clock, 0L);
        for (ThreadEvent event : history) {
            if (!thread.id.equals(event.threadId())) {
                throw new IllegalArgumentException("Event " + event.eventName() + " v" + event.version()
                        + " belongs to thread " + event.threadId() + ", not " + thread.id);
            }
            thread.recorder.advance(event);
            thread.apply(event);
        }
        return thread;
    }

    public static MailThread restore(String id, Subject subject, Collection<MailMessage> messages,
                                     boolean archived, boolean muted, Instant lastActivityAt, long version) {
        return restore(id, subject, messages, archived, muted, lastActivityAt, version, Clock.systemUTC());
    }

    /**
     * Rehydrate a thread from a stored snapshot without emitting events
     */
    public static MailThread restore(String id, Subject subject, Collection<MailMessage> messages,
                                     boolean archived, boolean muted, Instant lastActivityAt,
                                     long version, Clock clock) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("Thread " + id + " has no messages");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Thread " + id + " has invalid version " + version);
        }
        MailThread thread = new MailThread(id, clock, version);
        thread.subject = subject;
        for (MailMessage message : messages) {
            thread.messages.put(message.getId(), message);
        }
        thread.archived = archived;
        thread.muted = muted;
        thread.lastActivityAt = lastActivityAt;
        thread.recomputeParticipants();
        return thread;
    }

    // ---- Membership ----

    public void addMessage(MailMessage message) {
        if (message == null) {
            throw new InvalidValueException("Message is required");
        }
        if (messages.containsKey(message.getId())) {
            throw violation(Violation.DUPLICATE_MESSAGE, "addMessage", message.getId(),
                    "Email with ID " + message.getId() + " already exists in thread");
        }
        if (!ThreadingMatcher.matches(this, message)) {
            throw violation(Violation.NOT_PART_OF_THREAD, "addMessage", message.getId(),
                    "Email does not belong to this thread");
        }
        raise(new MessageAdded(id, recorder.nextVersion(), clock.instant(), message));
    }

    public void removeMessage(String messageId) {
        requireMessage("removeMessage", messageId);
        if (messages.size() == 1) {
            throw violation(Violation.LAST_MESSAGE_PROTECTED, "removeMessage", messageId,
                    "Cannot remove the last email from a thread");
        }
        raise(new MessageRemoved(id, recorder.nextVersion(), clock.instant(), messageId));
    }

    // ---- Thread-level state ----

    /**
     * Mark every unread message read. Nothing unread means nothing happens:
     * no event, no version change.
     */
    public void markAllRead() {
        List<String> unread = getMessages().stream()
                .filter(message -> !message.isRead())
                .map(MailMessage::getId)
                .collect(Collectors.toList());
        if (unread.isEmpty()) {
            return;
        }
        raise(new ThreadMarkedRead(id, recorder.nextVersion(), clock.instant(), unread));
    }

    public void archive() {
        if (archived) {
            throw violation(Violation.ALREADY_IN_STATE, "archive", id, "Thread is already archived");
        }
        raise(new ThreadArchived(id, recorder.nextVersion(), clock.instant()));
    }

    public void unarchive() {
        if (!archived) {
            throw violation(Violation.ALREADY_IN_STATE, "unarchive", id, "Thread is not archived");
        }
        raise(new ThreadUnarchived(id, recorder.nextVersion(), clock.instant()));
    }

    public void mute() {
        if (muted) {
            throw violation(Violation.ALREADY_IN_STATE, "mute", id, "Thread is already muted");
        }
        raise(new ThreadMuted(id, recorder.nextVersion(), clock.instant()));
    }

    public void unmute() {
        if (!muted) {
            throw violation(Violation.ALREADY_IN_STATE, "unmute", id, "Thread is not muted");
        }
        raise(new ThreadUnmuted(id, recorder.nextVersion(), clock.instant()));
    }

    // ---- Per-message flags ----

    public void markMessageRead(String messageId) {
        if (requireMessage("markMessageRead", messageId).isRead()) {
            throw violation(Violation.ALREADY_IN_STATE, "markMessageRead", messageId, "Email is already read");
        }
        raise(new MessageMarkedRead(id, recorder.nextVersion(), clock.instant(), messageId));
    }

    public void markMessageUnread(String messageId) {
        if (!requireMessage("markMessageUnread", messageId).isRead()) {
            throw violation(Violation.ALREADY_IN_STATE, "markMessageUnread", messageId, "Email is already unread");
        }
        raise(new MessageMarkedUnread(id, recorder.nextVersion(), clock.instant(), messageId));
    }

    public void flagMessage(String messageId) {
        if (requireMessage("flagMessage", messageId).isFlagged()) {
            throw violation(Violation.ALREADY_IN_STATE, "flagMessage", messageId, "Email is already flagged");
        }
        raise(new MessageFlagged(id, recorder.nextVersion(), clock.instant(), messageId));
    }

    public void unflagMessage(String messageId) {
        if (!requireMessage("unflagMessage", messageId).isFlagged()) {
            throw violation(Violation.ALREADY_IN_STATE, "unflagMessage", messageId, "Email is not flagged");
        }
        raise(new MessageUnflagged(id, recorder.nextVersion(), clock.instant(), messageId));
    }

    public void addLabel(String messageId, String label) {
        MailMessage message = requireMessage("addLabel", messageId);
        String normalized = MailMessage.normalizeLabel(label);
        if (message.getLabels().contains(normalized)) {
            throw violation(Violation.ALREADY_IN_STATE, "addLabel", messageId,
                    "Email already has label '" + normalized + "'");
        }
        raise(new MessageLabelAdded(id, recorder.nextVersion(), clock.instant(), messageId, normalized));
    }

    public void removeLabel(String messageId, String label) {
        MailMessage message = requireMessage("removeLabel", messageId);
        String normalized = MailMessage.normalizeLabel(label);
        if (!message.getLabels().contains(normalized)) {
            throw violation(Violation.ALREADY_IN_STATE, "removeLabel", messageId,
                    "Email has no label '" + normalized + "'");
        }
        raise(new MessageLabelRemoved(id, recorder.nextVersion(), clock.instant(), messageId, normalized));
    }

    // ---- Event application ----

    private void raise(ThreadEvent event) {
        recorder.record(event);
        apply(event);
    }

    private void apply(ThreadEvent event) {
        if (event instanceof ThreadCreated created) {
            subject = created.subject();
            putMessage(created.foundingMessage());
            lastActivityAt = created.foundingMessage().getSentAt();
        } else if (event instanceof MessageAdded added) {
            putMessage(added.message());
            lastActivityAt = added.occurredAt();
        } else if (event instanceof MessageRemoved removed) {
            messages.remove(removed.messageId());
            recomputeParticipants();
            lastActivityAt = removed.occurredAt();
        } else if (event instanceof ThreadMarkedRead markedRead) {
            for (String messageId : markedRead.messageIds()) {
                replaceMessage(messageId, loggedMessage(messageId).withRead(true));
            }
        } else if (event instanceof ThreadArchived) {
            archived = true;
            lastActivityAt = event.occurredAt();
        } else if (event instanceof ThreadUnarchived) {
            archived = false;
            lastActivityAt = event.occurredAt();
        } else if (event instanceof ThreadMuted) {
            muted = true;
        } else if (event instanceof ThreadUnmuted) {
            muted = false;
        } else if (event instanceof MessageMarkedRead read) {
            replaceMessage(read.messageId(), loggedMessage(read.messageId()).withRead(true));
        } else if (event instanceof MessageMarkedUnread unread) {
            replaceMessage(unread.messageId(), loggedMessage(unread.messageId()).withRead(false));
        } else if (event instanceof MessageFlagged flagged) {
            replaceMessage(flagged.messageId(), loggedMessage(flagged.messageId()).withFlagged(true));
        } else if (event instanceof MessageUnflagged unflagged) {
            replaceMessage(unflagged.messageId(), loggedMessage(unflagged.messageId()).withFlagged(false));
        } else if (event instanceof MessageLabelAdded labelAdded) {
            replaceMessage(labelAdded.messageId(),
                    loggedMessage(labelAdded.messageId()).withLabel(labelAdded.label()));
        } else if (event instanceof MessageLabelRemoved labelRemoved) {
            replaceMessage(labelRemoved.messageId(),
                    loggedMessage(labelRemoved.messageId()).withoutLabel(labelRemoved.label()));
        } else {
            throw new IllegalArgumentException("Unsupported thread event: " + event.eventName());
        }
    }

    private void putMessage(MailMessage message) {
        messages.put(message.getId(), message);
        recomputeParticipants();
    }

    private void replaceMessage(String messageId, MailMessage updated) {
        messages.put(messageId, updated);
    }

    private void recomputeParticipants() {
        participants.clear();
        for (MailMessage message : messages.values()) {
            participants.addAll(message.participantAddresses());
        }
    }

    // Events read back from a log may reference unknown messages if the log is corrupt
    private MailMessage loggedMessage(String messageId) {
        MailMessage message = messages.get(messageId);
        if (message == null) {
            throw new IllegalStateException("Event log of thread " + id + " references unknown email " + messageId);
        }
        return message;
    }

    private MailMessage requireMessage(String operation, String messageId) {
        MailMessage message = messageId == null ? null : messages.get(messageId);
        if (message == null) {
            throw violation(Violation.MESSAGE_NOT_FOUND, operation, messageId,
                    "Email with ID " + messageId + " not found in thread");
        }
        return message;
    }

    private InvariantViolationException violation(Violation violation, String operation,
                                                  String targetId, String message) {
        return new InvariantViolationException(violation, operation, id, targetId, message);
    }

    // ---- Queries ----

    public long getVersion() {
        return recorder.version();
    }

    /**
     * Messages ordered by sent time
     */
    public List<MailMessage> getMessages() {
        return messages.values().stream().sorted(CHRONOLOGICAL).collect(Collectors.toList());
    }

    public Optional<MailMessage> getMessage(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    public boolean containsMessage(String messageId) {
        return messages.containsKey(messageId);
    }

    public int getMessageCount() {
        return messages.size();
    }

    /**
     * Lower-cased addresses of every sender and recipient in the thread
     */
    public Set<String> getParticipants() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(participants));
    }

    public Set<String> externalMessageIds() {
        return messages.values().stream()
                .map(MailMessage::getExternalMessageId)
                .collect(Collectors.toSet());
    }

    public boolean hasUnreadMessages() {
        return messages.values().stream().anyMatch(message -> !message.isRead());
    }

    public int getUnreadCount() {
        return (int) messages.values().stream().filter(message -> !message.isRead()).count();
    }

    public MailMessage getLatestMessage() {
        List<MailMessage> ordered = getMessages();
        return ordered.get(ordered.size() - 1);
    }

    public long getTotalAttachmentSize() {
        return messages.values().stream().mapToLong(MailMessage::totalAttachmentSize).sum();
    }

    public List<ThreadEvent> getUncommittedEvents() {
        return recorder.uncommittedEvents();
    }

    public boolean hasUncommittedEvents() {
        return recorder.hasUncommittedEvents();
    }

    /**
     * Called by the storage side once the pending events are persisted
     */
    public void clearUncommittedEvents() {
        recorder.clearUncommittedEvents();
    }

    @Override
    public String toString() {
        return "MailThread{id=" + id + ", subject=" + subject + ", messages=" + messages.size()
                + ", version=" + recorder.version() + "}";
    }
}
