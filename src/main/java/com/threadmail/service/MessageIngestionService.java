package com.threadmail.service;

import com.threadmail.config.ThreadMailProperties;
import com.threadmail.domain.InvariantViolationException;
import com.threadmail.domain.MailMessage;
import com.threadmail.domain.MailThread;
import com.threadmail.domain.ThreadingMatcher;
import com.threadmail.domain.ThreadingMatcher.MatchReason;
import com.threadmail.repository.DuplicateMessageException;
import com.threadmail.repository.ThreadRepository;
import com.threadmail.util.EmlParser;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Incoming message processing
 * - Pick candidate threads: In-Reply-To target, then References (nearest ancestor first),
 *   then threads with the same normalized subject (most recent activity first)
 * - Admit the message to the first candidate the threading matcher accepts
 * - Open a new thread when no candidate accepts it
 * - Same Message-ID delivered twice is stored once, also when both copies race
 *   through different consumers (the storage layer rejects the second one)
 */
@Slf4j
@Service
public class MessageIngestionService {

    private final ThreadService threadService;
    private final ThreadRepository repository;
    private final ThreadMailProperties properties;
    private final Clock clock;
    private final Counter ingestedCounter;
    private final Counter duplicateCounter;

    public MessageIngestionService(ThreadService threadService,
            ThreadRepository repository,
            ThreadMailProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.threadService = threadService;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.ingestedCounter = Counter.builder("threadmail.messages.ingested")
                .description("Messages admitted to a new or existing thread")
                .register(meterRegistry);
        this.duplicateCounter = Counter.builder("threadmail.messages.duplicate")
                .description("Messages already present in their thread")
                .register(meterRegistry);
    }

    /**
     * Parse raw EML and thread it
     *
     * @return id of the thread that holds the message
     */
    public String ingestEml(byte[] emlData) {
        MailMessage message;
        try {
            message = EmlParser.toMailMessage(emlData, clock);
        } catch (MessagingException | IOException e) {
            throw new IllegalArgumentException("Unparseable EML (" + emlData.length + " bytes)", e);
        }
        return ingest(message);
    }

    /**
     * Thread an already parsed message
     *
     * @return id of the thread that holds the message
     */
    public String ingest(MailMessage message) {
        Optional<String> existing = findStoredThread(message);
        if (existing.isPresent()) {
            duplicateCounter.increment();
            log.info("Message {} already stored in thread {}", message.getExternalMessageId(), existing.get());
            return existing.get();
        }

        try {
            return thread(message);
        } catch (DuplicateMessageException e) {
            String holder = e.getExistingThreadId() != null
                    ? e.getExistingThreadId()
                    : findStoredThread(message).orElseThrow(() -> e);
            duplicateCounter.increment();
            log.info("Message {} was stored concurrently in thread {}", message.getExternalMessageId(), holder);
            return holder;
        }
    }

    private String thread(MailMessage message) {
        for (String candidateId : candidateThreadIds(message)) {
            Optional<MailThread> candidate = threadService.findThread(candidateId);
            if (candidate.isEmpty()) {
                continue;
            }
            MatchReason reason = ThreadingMatcher.evaluate(candidate.get(), message);
            if (reason == MatchReason.NONE) {
                continue;
            }
            if (admit(candidateId, message)) {
                ingestedCounter.increment();
                log.info("Message {} threaded into {} by {}", message.getExternalMessageId(), candidateId, reason);
                return candidateId;
            }
        }

        String threadId = threadService.startThread(message);
        ingestedCounter.increment();
        return threadId;
    }

    private Optional<String> findStoredThread(MailMessage message) {
        return repository.findThreadIdsByExternalMessageIds(List.of(message.getExternalMessageId()))
                .stream()
                .findFirst();
    }

    /**
     * @return false if the thread changed in between and no longer accepts the message
     */
    private boolean admit(String threadId, MailMessage message) {
        try {
            threadService.addMessage(threadId, message);
            return true;
        } catch (InvariantViolationException e) {
            if (e.getViolation() == InvariantViolationException.Violation.DUPLICATE_MESSAGE) {
                duplicateCounter.increment();
                return true;
            }
            if (e.getViolation() == InvariantViolationException.Violation.NOT_PART_OF_THREAD) {
                log.debug("Thread {} stopped matching message {}", threadId, message.getId());
                return false;
            }
            throw e;
        } catch (ThreadNotFoundException e) {
            log.debug("Candidate thread {} disappeared", threadId);
            return false;
        }
    }

    List<String> candidateThreadIds(MailMessage message) {
        Set<String> candidates = new LinkedHashSet<>();
        if (message.getInReplyTo() != null) {
            candidates.addAll(repository.findThreadIdsByExternalMessageIds(List.of(message.getInReplyTo())));
        }
        List<String> references = new ArrayList<>(message.getReferences());
        Collections.reverse(references);
        for (String reference : references) {
            candidates.addAll(repository.findThreadIdsByExternalMessageIds(List.of(reference)));
        }
        candidates.addAll(repository.findThreadIdsBySubject(message.getSubject().normalized(),
                properties.getThreading().getCandidateLimit()));
        return new ArrayList<>(candidates);
    }
}
