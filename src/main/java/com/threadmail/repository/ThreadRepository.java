package com.threadmail.repository;

import com.threadmail.domain.MailThread;
import com.threadmail.domain.event.ThreadEvent;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator for {@link MailThread} aggregates.
 * The aggregate never calls it; the application service runs load, mutate, save.
 */
public interface ThreadRepository {

    Optional<MailThread> load(String threadId);

    /**
     * Persist the thread snapshot if the stored version still equals {@code expectedVersion}.
     * {@code expectedVersion == 0} means the thread is new.
     *
     * @throws ConcurrencyConflictException if another writer got there first
     * @throws DuplicateMessageException if a new message's Message-ID is already stored
     */
    void save(MailThread thread, long expectedVersion);

    /**
     * Append committed events to the thread's log.
     *
     * @throws ConcurrencyConflictException if a version in the batch is already taken
     */
    void appendEvents(List<? extends ThreadEvent> events);

    /**
     * Full event log of a thread, ordered by version
     */
    List<ThreadEvent> loadEvents(String threadId);

    /**
     * Threads containing a message with one of the given external Message-IDs
     */
    List<String> findThreadIdsByExternalMessageIds(Collection<String> externalMessageIds);

    /**
     * Every stored thread, most recent activity first
     */
    List<String> findThreadIds();

    /**
     * Threads whose normalized subject equals the given one, most recent activity first
     */
    List<String> findThreadIdsBySubject(String normalizedSubject, int limit);

    /**
     * Retention: drop the thread with its messages and event log
     */
    boolean delete(String threadId);
}
