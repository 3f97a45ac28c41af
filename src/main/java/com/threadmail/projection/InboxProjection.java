package com.threadmail.projection;

import com.threadmail.domain.MailMessage;
import com.threadmail.domain.event.MessageAdded;
import com.threadmail.domain.event.MessageMarkedRead;
import com.threadmail.domain.event.MessageMarkedUnread;
import com.threadmail.domain.event.MessageRemoved;
import com.threadmail.domain.event.ThreadArchived;
import com.threadmail.domain.event.ThreadCreated;
import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.domain.event.ThreadMarkedRead;
import com.threadmail.domain.event.ThreadMuted;
import com.threadmail.domain.event.ThreadUnarchived;
import com.threadmail.domain.event.ThreadUnmuted;
import com.threadmail.repository.ThreadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory inbox read model built only from thread events
 * - Inbox / archived lists, most recent activity first
 * - Unread counts per thread and across the inbox
 * Events are applied at most once per (threadId, version); older or repeated
 * deliveries are ignored. A thread the model has never seen, or an event that
 * skips versions, is rebuilt from the stored event log instead, so the model
 * never moves past a version it has not applied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboxProjection {

    private static final Comparator<ThreadSummary> MOST_RECENT_FIRST =
            Comparator.comparing(ThreadSummary::lastActivityAt).reversed();

    private final ThreadRepository repository;
    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * @return true if the event changed the model
     */
    public synchronized boolean apply(ThreadEvent event) {
        Entry entry = entries.get(event.threadId());

        if (entry != null && event.version() <= entry.version) {
            return false;
        }
        if (entry == null && event instanceof ThreadCreated created && event.version() == 1) {
            entries.put(event.threadId(), start(created));
            return true;
        }
        if (entry == null || event.version() != entry.version + 1) {
            log.info("Rebuilding thread {} from its log: got {} v{}, model at v{}", event.threadId(),
                    event.eventName(), event.version(), entry == null ? 0 : entry.version);
            Entry rebuilt = rebuild(event.threadId());
            if (rebuilt == null) {
                return false;
            }
            if (event.version() == rebuilt.version + 1) {
                advance(rebuilt, event);
            }
            return rebuilt.version >= event.version();
        }

        advance(entry, event);
        return true;
    }

    /**
     * Load every stored thread into the model
     */
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void rebuildAll() {
        entries.clear();
        List<String> threadIds = repository.findThreadIds();
        for (String threadId : threadIds) {
            rebuild(threadId);
        }
        log.info("Inbox rebuilt from {} stored threads", threadIds.size());
    }

    /**
     * Replace the thread's entry with one replayed from its stored log.
     * An empty or headless log drops the entry.
     */
    private Entry rebuild(String threadId) {
        List<ThreadEvent> events = repository.loadEvents(threadId);
        if (events.isEmpty() || !(events.get(0) instanceof ThreadCreated created)) {
            log.warn("No usable event log for thread {}", threadId);
            entries.remove(threadId);
            return null;
        }
        Entry entry = start(created);
        for (ThreadEvent event : events.subList(1, events.size())) {
            if (event.version() != entry.version + 1) {
                log.warn("Stored log of thread {} skips from v{} to v{}", threadId, entry.version, event.version());
                break;
            }
            advance(entry, event);
        }
        entries.put(threadId, entry);
        return entry;
    }

    private static Entry start(ThreadCreated created) {
        Entry entry = new Entry(created.subject().raw());
        entry.put(created.foundingMessage());
        entry.lastActivityAt = created.foundingMessage().getSentAt();
        entry.version = created.version();
        return entry;
    }

    private static void advance(Entry entry, ThreadEvent event) {
        if (event instanceof MessageAdded added) {
            entry.put(added.message());
            entry.lastActivityAt = added.occurredAt();
        } else if (event instanceof MessageRemoved removed) {
            entry.messages.remove(removed.messageId());
            entry.lastActivityAt = removed.occurredAt();
        } else if (event instanceof ThreadMarkedRead markedRead) {
            for (String messageId : markedRead.messageIds()) {
                entry.setRead(messageId, true);
            }
        } else if (event instanceof MessageMarkedRead read) {
            entry.setRead(read.messageId(), true);
        } else if (event instanceof MessageMarkedUnread unread) {
            entry.setRead(unread.messageId(), false);
        } else if (event instanceof ThreadArchived) {
            entry.archived = true;
            entry.lastActivityAt = event.occurredAt();
        } else if (event instanceof ThreadUnarchived) {
            entry.archived = false;
            entry.lastActivityAt = event.occurredAt();
        } else if (event instanceof ThreadMuted) {
            entry.muted = true;
        } else if (event instanceof ThreadUnmuted) {
            entry.muted = false;
        }
        // Flag and label events only advance the version here

        entry.version = event.version();
    }

    /**
     * Threads not archived, most recent activity first
     */
    public synchronized List<ThreadSummary> inbox() {
        return entries.entrySet().stream()
                .filter(e -> !e.getValue().archived)
                .map(e -> e.getValue().toSummary(e.getKey()))
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toList());
    }

    public synchronized List<ThreadSummary> archived() {
        return entries.entrySet().stream()
                .filter(e -> e.getValue().archived)
                .map(e -> e.getValue().toSummary(e.getKey()))
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toList());
    }

    public synchronized Optional<ThreadSummary> find(String threadId) {
        Entry entry = entries.get(threadId);
        return entry == null ? Optional.empty() : Optional.of(entry.toSummary(threadId));
    }

    /**
     * Unread messages in threads that are neither archived nor muted
     */
    public synchronized int totalUnread() {
        return entries.values().stream()
                .filter(entry -> !entry.archived && !entry.muted)
                .mapToInt(Entry::unreadCount)
                .sum();
    }

    public synchronized void forget(String threadId) {
        entries.remove(threadId);
    }

    public synchronized void clear() {
        entries.clear();
    }

    private static final class Entry {

        private final String subject;
        private final Map<String, MessageState> messages = new HashMap<>();
        private boolean archived;
        private boolean muted;
        private Instant lastActivityAt;
        private long version;

        Entry(String subject) {
            this.subject = subject;
        }

        void put(MailMessage message) {
            messages.put(message.getId(), new MessageState(
                    message.isRead(), message.getSentAt(), message.participantAddresses(),
                    message.getContent().preview()));
        }

        void setRead(String messageId, boolean read) {
            messages.computeIfPresent(messageId, (id, state) -> state.withRead(read));
        }

        int unreadCount() {
            return (int) messages.values().stream().filter(state -> !state.read()).count();
        }

        ThreadSummary toSummary(String threadId) {
            Set<String> participants = new LinkedHashSet<>();
            messages.values().forEach(state -> participants.addAll(state.participants()));
            String latestPreview = messages.values().stream()
                    .max(Comparator.comparing(MessageState::sentAt))
                    .map(MessageState::preview)
                    .orElse("");
            return new ThreadSummary(threadId, subject, Set.copyOf(participants), messages.size(),
                    unreadCount(), archived, muted, lastActivityAt, latestPreview, version);
        }
    }

    private record MessageState(boolean read, Instant sentAt, Set<String> participants, String preview) {

        MessageState withRead(boolean read) {
            return new MessageState(read, sentAt, participants, preview);
        }
    }
}
