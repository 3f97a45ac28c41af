package com.threadmail.repository;

import com.threadmail.domain.Attachment;
import com.threadmail.domain.Content;
import com.threadmail.domain.EmailAddress;
import com.threadmail.domain.MailMessage;
import com.threadmail.domain.MailThread;
import com.threadmail.domain.Subject;
import com.threadmail.domain.event.ThreadEvent;
import com.threadmail.mapper.MailThreadMapper;
import com.threadmail.mapper.MessageAttachmentMapper;
import com.threadmail.mapper.ThreadEventMapper;
import com.threadmail.mapper.ThreadMessageMapper;
import com.threadmail.mapper.row.AttachmentRow;
import com.threadmail.mapper.row.EventRow;
import com.threadmail.mapper.row.MessageRow;
import com.threadmail.mapper.row.ThreadRow;
import com.threadmail.util.ThreadJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * MyBatis + SQLite thread storage
 * - Snapshot tables: MAIL_THREAD, THREAD_MESSAGE, MESSAGE_ATTACHMENT
 * - Append-only log: THREAD_EVENT, keyed by (thread_id, version)
 * - Optimistic locking on MAIL_THREAD.version
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MyBatisThreadRepository implements ThreadRepository {

    private final MailThreadMapper threadMapper;
    private final ThreadMessageMapper messageMapper;
    private final MessageAttachmentMapper attachmentMapper;
    private final ThreadEventMapper eventMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<MailThread> load(String threadId) {
        ThreadRow row = threadMapper.findById(threadId);
        if (row == null) {
            return Optional.empty();
        }

        Map<String, List<Attachment>> attachmentsByMessage = new LinkedHashMap<>();
        for (AttachmentRow attachment : attachmentMapper.findByThreadId(threadId)) {
            attachmentsByMessage.computeIfAbsent(attachment.getMessageId(), id -> new ArrayList<>())
                    .add(toAttachment(attachment));
        }

        List<MailMessage> messages = messageMapper.findByThreadId(threadId).stream()
                .map(message -> toMessage(message, attachmentsByMessage.getOrDefault(message.getMessageId(), List.of())))
                .collect(Collectors.toList());

        return Optional.of(MailThread.restore(
                row.getThreadId(),
                new Subject(row.getSubject()),
                messages,
                row.getIsArchived() == 1,
                row.getIsMuted() == 1,
                Instant.parse(row.getLastActivityAt()),
                row.getVersion(),
                clock));
    }

    @Override
    @Transactional
    public void save(MailThread thread, long expectedVersion) {
        ThreadRow row = toRow(thread);

        if (expectedVersion == 0) {
            Long stored = threadMapper.findVersion(thread.getId());
            if (stored != null) {
                throw new ConcurrencyConflictException(thread.getId(), expectedVersion, stored);
            }
            row.setCreatedAt(clock.instant().toString());
            try {
                threadMapper.insert(row);
            } catch (DataIntegrityViolationException e) {
                throw new ConcurrencyConflictException(thread.getId(), expectedVersion,
                        threadMapper.findVersion(thread.getId()));
            }
        } else if (threadMapper.updateIfVersion(row, expectedVersion) == 0) {
            throw new ConcurrencyConflictException(thread.getId(), expectedVersion,
                    threadMapper.findVersion(thread.getId()));
        }

        // Message bodies never change once stored; only flags and labels do
        Set<String> storedIds = new HashSet<>(messageMapper.findIdsByThreadId(thread.getId()));
        for (MailMessage message : thread.getMessages()) {
            if (storedIds.remove(message.getId())) {
                messageMapper.updateFlags(message.getId(),
                        message.isRead() ? 1 : 0,
                        message.isFlagged() ? 1 : 0,
                        ThreadJson.writeStrings(message.getLabels()));
            } else {
                insertMessage(thread.getId(), message);
                for (Attachment attachment : message.getAttachments()) {
                    attachmentMapper.insert(toRow(message.getId(), attachment));
                }
            }
        }
        for (String removedId : storedIds) {
            attachmentMapper.deleteByMessageId(removedId);
            messageMapper.deleteById(removedId);
        }

        log.debug("Thread saved: {} v{} (expected v{})", thread.getId(), thread.getVersion(), expectedVersion);
    }

    // Message-ID is unique across all threads; the index backs up the lookup
    private void insertMessage(String threadId, MailMessage message) {
        String externalId = message.getExternalMessageId();
        List<String> holders = messageMapper.findThreadIdsByExternalMessageIds(List.of(externalId));
        if (!holders.isEmpty()) {
            throw new DuplicateMessageException(externalId, holders.get(0));
        }
        try {
            messageMapper.insert(toRow(threadId, message));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateMessageException(externalId, null, e);
        }
    }

    @Override
    @Transactional
    public void appendEvents(List<? extends ThreadEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        Map<String, Long> lastVersions = new LinkedHashMap<>();
        for (ThreadEvent event : events) {
            long last = lastVersions.computeIfAbsent(event.threadId(), this::lastStoredVersion);
            if (event.version() != last + 1) {
                throw new ConcurrencyConflictException(event.threadId(), event.version() - 1, last);
            }
            try {
                eventMapper.insert(EventRow.builder()
                        .threadId(event.threadId())
                        .version(event.version())
                        .eventName(event.eventName())
                        .eventData(ThreadJson.encodeEvent(event))
                        .occurredAt(event.occurredAt().toString())
                        .build());
            } catch (DataIntegrityViolationException e) {
                throw new ConcurrencyConflictException(event.threadId(), event.version() - 1,
                        lastStoredVersion(event.threadId()));
            }
            lastVersions.put(event.threadId(), event.version());
        }
        log.debug("Appended {} events", events.size());
    }

    private long lastStoredVersion(String threadId) {
        Long last = eventMapper.findLastVersion(threadId);
        return last == null ? 0L : last;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ThreadEvent> loadEvents(String threadId) {
        return eventMapper.findByThreadId(threadId).stream()
                .map(row -> ThreadJson.decodeEvent(
                        row.getThreadId(),
                        row.getVersion(),
                        Instant.parse(row.getOccurredAt()),
                        row.getEventName(),
                        row.getEventData()))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findThreadIdsByExternalMessageIds(Collection<String> externalMessageIds) {
        if (externalMessageIds == null || externalMessageIds.isEmpty()) {
            return List.of();
        }
        return messageMapper.findThreadIdsByExternalMessageIds(externalMessageIds);
    }

    @Override
    public List<String> findThreadIds() {
        return threadMapper.findAllIds();
    }

    @Override
    public List<String> findThreadIdsBySubject(String normalizedSubject, int limit) {
        return threadMapper.findIdsByNormalizedSubject(normalizedSubject.toLowerCase(Locale.ROOT), limit);
    }

    @Override
    @Transactional
    public boolean delete(String threadId) {
        attachmentMapper.deleteByThreadId(threadId);
        messageMapper.deleteByThreadId(threadId);
        eventMapper.deleteByThreadId(threadId);
        boolean deleted = threadMapper.deleteById(threadId) > 0;
        if (deleted) {
            log.info("Thread deleted: {}", threadId);
        }
        return deleted;
    }

    // ---- Row mapping ----

    private static ThreadRow toRow(MailThread thread) {
        return ThreadRow.builder()
                .threadId(thread.getId())
                .subject(thread.getSubject().raw())
                .normalizedSubject(thread.getSubject().normalized().toLowerCase(Locale.ROOT))
                .isArchived(thread.isArchived() ? 1 : 0)
                .isMuted(thread.isMuted() ? 1 : 0)
                .messageCount(thread.getMessageCount())
                .participantCount(thread.getParticipants().size())
                .lastActivityAt(thread.getLastActivityAt().toString())
                .version(thread.getVersion())
                .build();
    }

    private static MessageRow toRow(String threadId, MailMessage message) {
        return MessageRow.builder()
                .messageId(message.getId())
                .threadId(threadId)
                .externalMessageId(message.getExternalMessageId())
                .subject(message.getSubject().raw())
                .fromAddress(message.getFrom().address())
                .fromName(message.getFrom().displayName())
                .toAddresses(ThreadJson.writeAddresses(message.getTo()))
                .ccAddresses(ThreadJson.writeAddresses(message.getCc()))
                .bccAddresses(ThreadJson.writeAddresses(message.getBcc()))
                .contentPlain(message.getContent().plainText())
                .contentHtml(message.getContent().html())
                .sentAt(message.getSentAt().toString())
                .inReplyTo(message.getInReplyTo())
                .referenceIds(ThreadJson.writeStrings(message.getReferences()))
                .isRead(message.isRead() ? 1 : 0)
                .isFlagged(message.isFlagged() ? 1 : 0)
                .labels(ThreadJson.writeStrings(message.getLabels()))
                .build();
    }

    private static AttachmentRow toRow(String messageId, Attachment attachment) {
        return AttachmentRow.builder()
                .attachmentId(attachment.id())
                .messageId(messageId)
                .filename(attachment.filename())
                .mimeType(attachment.mimeType())
                .sizeBytes(attachment.sizeBytes())
                .contentId(attachment.contentId())
                .isInline(attachment.inline() ? 1 : 0)
                .build();
    }

    private static MailMessage toMessage(MessageRow row, List<Attachment> attachments) {
        return MailMessage.builder()
                .id(row.getMessageId())
                .externalMessageId(row.getExternalMessageId())
                .subject(new Subject(row.getSubject()))
                .from(new EmailAddress(row.getFromAddress(), row.getFromName()))
                .to(ThreadJson.readAddresses(row.getToAddresses()))
                .cc(ThreadJson.readAddresses(row.getCcAddresses()))
                .bcc(ThreadJson.readAddresses(row.getBccAddresses()))
                .content(new Content(row.getContentPlain(), row.getContentHtml()))
                .sentAt(Instant.parse(row.getSentAt()))
                .attachments(attachments)
                .inReplyTo(row.getInReplyTo())
                .references(ThreadJson.readStrings(row.getReferenceIds()))
                .read(row.getIsRead() == 1)
                .flagged(row.getIsFlagged() == 1)
                .labels(ThreadJson.readStringSet(row.getLabels()))
                .build();
    }

    private static Attachment toAttachment(AttachmentRow row) {
        return new Attachment(row.getAttachmentId(), row.getFilename(), row.getMimeType(),
                row.getSizeBytes(), row.getContentId(), row.getIsInline() == 1);
    }
}
