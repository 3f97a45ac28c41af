package com.threadmail.service;

import com.threadmail.config.ThreadMailProperties;
import com.threadmail.domain.InvariantViolationException;
import com.threadmail.domain.InvariantViolationException.Violation;
import com.threadmail.domain.MailMessage;
import com.threadmail.domain.MailThread;
import com.threadmail.repository.DuplicateMessageException;
import com.threadmail.repository.ThreadRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.threadmail.domain.MailFixtures.CLOCK;
import static com.threadmail.domain.MailFixtures.NOW;
import static com.threadmail.domain.MailFixtures.externalId;
import static com.threadmail.domain.MailFixtures.message;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MessageIngestionService unit tests
 */
@ExtendWith(MockitoExtension.class)
class MessageIngestionServiceTest {

    @Mock
    private ThreadService threadService;

    @Mock
    private ThreadRepository repository;

    private final Map<String, String> threadByExternalId = new HashMap<>();
    private SimpleMeterRegistry meterRegistry;
    private MessageIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        ingestionService = new MessageIngestionService(threadService, repository, new ThreadMailProperties(),
                CLOCK, meterRegistry);
    }

    private void stubExternalIdLookup() {
        when(repository.findThreadIdsByExternalMessageIds(anyCollection())).thenAnswer(invocation -> {
            Collection<String> ids = invocation.getArgument(0);
            return ids.stream().map(threadByExternalId::get).filter(Objects::nonNull).distinct()
                    .collect(Collectors.toList());
        });
    }

    private static MailThread kickoff(String threadId) {
        return MailThread.create(threadId, message("m1", "Project Kickoff").build(), CLOCK);
    }

    @Test
    @DisplayName("Message-ID already stored: returns its thread and touches nothing")
    void testDuplicateExternalId() {
        threadByExternalId.put(externalId("m1"), "t1");
        stubExternalIdLookup();

        String threadId = ingestionService.ingest(message("m1", "Project Kickoff").build());

        assertThat(threadId).isEqualTo("t1");
        verify(threadService, never()).startThread(any());
        verify(threadService, never()).addMessage(anyString(), any());
        assertThat(meterRegistry.counter("threadmail.messages.duplicate").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Same Message-ID stored by a concurrent consumer: returns the thread that won")
    void testConcurrentDuplicate() {
        MailMessage message = message("m1", "Project Kickoff").build();
        when(threadService.startThread(message)).thenThrow(new DuplicateMessageException(externalId("m1"), "t1"));

        assertThat(ingestionService.ingest(message)).isEqualTo("t1");
        assertThat(meterRegistry.counter("threadmail.messages.duplicate").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("threadmail.messages.ingested").count()).isZero();
    }

    @Test
    @DisplayName("Duplicate caught only by the unique index is resolved by a second lookup")
    void testConcurrentDuplicateFromIndex() {
        MailMessage message = message("m1", "Project Kickoff").build();
        when(repository.findThreadIdsByExternalMessageIds(List.of(externalId("m1"))))
                .thenReturn(List.of(), List.of("t1"));
        when(threadService.startThread(message)).thenThrow(new DuplicateMessageException(externalId("m1"), null));

        assertThat(ingestionService.ingest(message)).isEqualTo("t1");
        assertThat(meterRegistry.counter("threadmail.messages.duplicate").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Reply is threaded into the In-Reply-To target")
    void testReplyJoinsParentThread() {
        threadByExternalId.put(externalId("m1"), "t1");
        stubExternalIdLookup();
        MailThread thread = kickoff("t1");
        when(threadService.findThread("t1")).thenReturn(Optional.of(thread));
        MailMessage reply = message("m2", "Different subject").inReplyTo(externalId("m1")).build();
        when(threadService.addMessage("t1", reply)).thenReturn(thread);

        String threadId = ingestionService.ingest(reply);

        assertThat(threadId).isEqualTo("t1");
        verify(threadService, never()).startThread(any());
        assertThat(meterRegistry.counter("threadmail.messages.ingested").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("No matching candidate starts a new thread")
    void testNewThread() {
        stubExternalIdLookup();
        MailMessage message = message("m9", "Lunch plans").build();
        when(threadService.startThread(message)).thenReturn("t-new");

        assertThat(ingestionService.ingest(message)).isEqualTo("t-new");
    }

    @Test
    @DisplayName("Candidates: In-Reply-To, then References nearest first, then same subject")
    void testCandidateOrder() {
        threadByExternalId.put("<parent@example.com>", "t-parent");
        threadByExternalId.put("<root@example.com>", "t-root");
        threadByExternalId.put("<middle@example.com>", "t-middle");
        stubExternalIdLookup();
        when(repository.findThreadIdsBySubject("Budget", 20)).thenReturn(List.of("t-subject", "t-root"));

        MailMessage message = message("m2", "Re: Budget")
                .inReplyTo("<parent@example.com>")
                .references(List.of("<root@example.com>", "<middle@example.com>", "<parent@example.com>"))
                .build();

        assertThat(ingestionService.candidateThreadIds(message))
                .containsExactly("t-parent", "t-middle", "t-root", "t-subject");
    }

    @Test
    @DisplayName("Candidate that stops matching before the write falls through to a new thread")
    void testCandidateRejects() {
        when(repository.findThreadIdsBySubject(anyString(), anyInt())).thenReturn(List.of("t1"));
        when(threadService.findThread("t1")).thenReturn(Optional.of(kickoff("t1")));
        MailMessage reply = message("m2", "Re: Project Kickoff").build();
        when(threadService.addMessage("t1", reply)).thenThrow(new InvariantViolationException(
                Violation.NOT_PART_OF_THREAD, "addMessage", "t1", "m2", "Email does not belong to this thread"));
        when(threadService.startThread(reply)).thenReturn("t2");

        assertThat(ingestionService.ingest(reply)).isEqualTo("t2");
    }

    @Test
    @DisplayName("Message already inside the candidate counts as stored there")
    void testCandidateAlreadyHoldsMessage() {
        when(repository.findThreadIdsBySubject(anyString(), anyInt())).thenReturn(List.of("t1"));
        when(threadService.findThread("t1")).thenReturn(Optional.of(kickoff("t1")));
        MailMessage reply = message("m2", "Re: Project Kickoff").build();
        when(threadService.addMessage("t1", reply)).thenThrow(new InvariantViolationException(
                Violation.DUPLICATE_MESSAGE, "addMessage", "t1", "m2", "Email with ID m2 already exists in thread"));

        assertThat(ingestionService.ingest(reply)).isEqualTo("t1");
        verify(threadService, never()).startThread(any());
    }

    @Test
    @DisplayName("Vanished candidate is skipped")
    void testMissingCandidate() {
        when(repository.findThreadIdsBySubject(anyString(), anyInt())).thenReturn(List.of("gone"));
        when(threadService.findThread("gone")).thenReturn(Optional.empty());
        when(threadService.startThread(any())).thenReturn("t2");

        assertThat(ingestionService.ingest(message("m2", "Re: Project Kickoff").build())).isEqualTo("t2");
    }

    @Test
    @DisplayName("Raw EML is parsed before threading")
    void testIngestEml() throws Exception {
        byte[] eml;
        try (InputStream is = getClass().getResourceAsStream("/eml/reply-with-attachment.eml")) {
            eml = is.readAllBytes();
        }
        when(threadService.startThread(argThat(m -> m.getExternalMessageId().equals("<m2@example.com>"))))
                .thenReturn("t-new");

        assertThat(ingestionService.ingestEml(eml)).isEqualTo("t-new");
    }

    @Test
    @DisplayName("EML without a Date header takes the sent time from the clock")
    void testIngestEmlWithoutDate() throws Exception {
        byte[] eml;
        try (InputStream is = getClass().getResourceAsStream("/eml/html-only.eml")) {
            eml = is.readAllBytes();
        }
        when(threadService.startThread(argThat(m -> NOW.equals(m.getSentAt())))).thenReturn("t-new");

        assertThat(ingestionService.ingestEml(eml)).isEqualTo("t-new");
    }

    @Test
    @DisplayName("EML without a sender is rejected")
    void testIngestEmlWithoutSender() {
        byte[] eml = "Subject: hi\r\n\r\nbody".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> ingestionService.ingestEml(eml)).isInstanceOf(IllegalArgumentException.class);
        verify(threadService, never()).startThread(any());
    }
}
