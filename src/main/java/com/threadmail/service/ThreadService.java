package com.threadmail.service;

import com.threadmail.config.ThreadMailProperties;
import com.threadmail.domain.MailMessage;
import com.threadmail.domain.MailThread;
import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.queue.ThreadEventPublisher;
import com.threadmail.repository.ConcurrencyConflictException;
import com.threadmail.repository.ThreadRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.JmsException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Thread application service
 * - Load, mutate, save + append events in one transaction, then publish
 * - One writer per thread id inside this process (striped locks)
 * - Reload and retry on optimistic-lock conflicts, up to the configured attempts
 * - Invariant violations are passed to the caller untouched
 */
@Slf4j
@Service
public class ThreadService {

    private final ThreadRepository repository;
    private final ThreadEventPublisher eventPublisher;
    private final TransactionOperations transactions;
    private final ThreadMailProperties properties;
    private final Clock clock;
    private final Lock[] locks;
    private final Counter threadsCreatedCounter;
    private final Counter commitCounter;
    private final Counter conflictCounter;

    public ThreadService(ThreadRepository repository,
            ThreadEventPublisher eventPublisher,
            TransactionOperations transactions,
            ThreadMailProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.transactions = transactions;
        this.properties = properties;
        this.clock = clock;
        this.locks = new Lock[Math.max(1, properties.getConcurrency().getLockStripes())];
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
        this.threadsCreatedCounter = Counter.builder("threadmail.threads.created")
                .description("Threads opened by a founding message")
                .register(meterRegistry);
        this.commitCounter = Counter.builder("threadmail.thread.commits")
                .description("Committed thread mutations")
                .register(meterRegistry);
        this.conflictCounter = Counter.builder("threadmail.thread.conflicts")
                .description("Optimistic-lock conflicts on save")
                .register(meterRegistry);
    }

    /**
     * Open a new thread with its founding message
     *
     * @return new thread id
     */
    public String startThread(MailMessage foundingMessage) {
        String threadId = UUID.randomUUID().toString();
        MailThread thread = MailThread.create(threadId, foundingMessage, clock);
        Lock lock = lockFor(threadId);
        lock.lock();
        try {
            commit(thread, 0L);
        } finally {
            lock.unlock();
        }
        threadsCreatedCounter.increment();
        log.info("Thread created: {} subject=\"{}\" from={}", threadId,
                foundingMessage.getSubject(), foundingMessage.getFrom().address());
        return threadId;
    }

    public MailThread addMessage(String threadId, MailMessage message) {
        return mutate(threadId, "addMessage", thread -> thread.addMessage(message));
    }

    public MailThread removeMessage(String threadId, String messageId) {
        return mutate(threadId, "removeMessage", thread -> thread.removeMessage(messageId));
    }

    public MailThread markAllRead(String threadId) {
        return mutate(threadId, "markAllRead", MailThread::markAllRead);
    }

    public MailThread archive(String threadId) {
        return mutate(threadId, "archive", MailThread::archive);
    }

    public MailThread unarchive(String threadId) {
        return mutate(threadId, "unarchive", MailThread::unarchive);
    }

    public MailThread mute(String threadId) {
        return mutate(threadId, "mute", MailThread::mute);
    }

    public MailThread unmute(String threadId) {
        return mutate(threadId, "unmute", MailThread::unmute);
    }

    public MailThread markMessageRead(String threadId, String messageId) {
        return mutate(threadId, "markMessageRead", thread -> thread.markMessageRead(messageId));
    }

    public MailThread markMessageUnread(String threadId, String messageId) {
        return mutate(threadId, "markMessageUnread", thread -> thread.markMessageUnread(messageId));
    }

    public MailThread flagMessage(String threadId, String messageId) {
        return mutate(threadId, "flagMessage", thread -> thread.flagMessage(messageId));
    }

    public MailThread unflagMessage(String threadId, String messageId) {
        return mutate(threadId, "unflagMessage", thread -> thread.unflagMessage(messageId));
    }

    public MailThread addLabel(String threadId, String messageId, String label) {
        return mutate(threadId, "addLabel", thread -> thread.addLabel(messageId, label));
    }

    public MailThread removeLabel(String threadId, String messageId, String label) {
        return mutate(threadId, "removeLabel", thread -> thread.removeLabel(messageId, label));
    }

    public Optional<MailThread> findThread(String threadId) {
        return repository.load(threadId);
    }

    public MailThread getThread(String threadId) {
        return repository.load(threadId).orElseThrow(() -> new ThreadNotFoundException(threadId));
    }

    public List<ThreadEvent> getEvents(String threadId) {
        return repository.loadEvents(threadId);
    }

    /**
     * Rebuild a thread purely from its event log (audit / verification)
     */
    public MailThread replayThread(String threadId) {
        List<ThreadEvent> events = repository.loadEvents(threadId);
        if (events.isEmpty()) {
            throw new ThreadNotFoundException(threadId);
        }
        return MailThread.replay(events, clock);
    }

    /**
     * Retention: remove the thread, its messages and its log
     */
    public boolean deleteThread(String threadId) {
        Lock lock = lockFor(threadId);
        lock.lock();
        try {
            Boolean deleted = transactions.execute(status -> repository.delete(threadId));
            return Boolean.TRUE.equals(deleted);
        } finally {
            lock.unlock();
        }
    }

    private MailThread mutate(String threadId, String operation, Consumer<MailThread> mutation) {
        int maxAttempts = Math.max(1, properties.getConcurrency().getMaxAttempts());
        Lock lock = lockFor(threadId);
        lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                MailThread thread = getThread(threadId);
                long loadedVersion = thread.getVersion();

                mutation.accept(thread);
                if (!thread.hasUncommittedEvents()) {
                    log.debug("{} on thread {} changed nothing (v{})", operation, threadId, loadedVersion);
                    return thread;
                }

                try {
                    commit(thread, loadedVersion);
                    return thread;
                } catch (ConcurrencyConflictException e) {
                    conflictCounter.increment();
                    if (attempt >= maxAttempts) {
                        log.warn("{} on thread {} gave up after {} conflicting attempts", operation, threadId, attempt);
                        throw e;
                    }
                    log.warn("{} on thread {} conflicted at v{} (attempt {}/{}), reloading",
                            operation, threadId, loadedVersion, attempt, maxAttempts);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void commit(MailThread thread, long expectedVersion) {
        List<ThreadEvent> events = thread.getUncommittedEvents();
        transactions.executeWithoutResult(status -> {
            repository.save(thread, expectedVersion);
            repository.appendEvents(events);
        });
        thread.clearUncommittedEvents();
        commitCounter.increment();

        log.info("Thread {} committed v{} -> v{}: {}", thread.getId(), expectedVersion, thread.getVersion(),
                events.stream().map(ThreadEvent::eventName).collect(Collectors.joining(",")));

        // The log is already durable; read models can be rebuilt from it if publishing fails
        try {
            eventPublisher.publish(events);
        } catch (JmsException e) {
            log.error("Failed to publish {} events of thread {}", events.size(), thread.getId(), e);
        }
    }

    private Lock lockFor(String threadId) {
        return locks[Math.floorMod(threadId.hashCode(), locks.length)];
    }
}
