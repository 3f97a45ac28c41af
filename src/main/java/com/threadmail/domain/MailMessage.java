package com.threadmail.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Message entity owned by a {@link MailThread}.
 * Instances are immutable snapshots: read/flag/label changes produce a new
 * snapshot that replaces the old one inside the owning thread.
 */
@Getter
@ToString(of = {"id", "externalMessageId", "subject", "sentAt"})
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class MailMessage {

    @EqualsAndHashCode.Include
    private final String id;
    private final String externalMessageId;
    private final Subject subject;
    private final EmailAddress from;
    private final List<EmailAddress> to;
    private final List<EmailAddress> cc;
    private final List<EmailAddress> bcc;
    private final Content content;
    private final Instant sentAt;
    private final List<Attachment> attachments;
    private final String inReplyTo;       // External Message-ID of the parent
    private final List<String> references;
    private final boolean read;
    private final boolean flagged;
    private final Set<String> labels;

    @Builder(toBuilder = true)
    private MailMessage(String id,
                        String externalMessageId,
                        Subject subject,
                        EmailAddress from,
                        List<EmailAddress> to,
                        List<EmailAddress> cc,
                        List<EmailAddress> bcc,
                        Content content,
                        Instant sentAt,
                        List<Attachment> attachments,
                        String inReplyTo,
                        List<String> references,
                        boolean read,
                        boolean flagged,
                        Set<String> labels) {
        if (id == null || id.isBlank()) {
            throw new InvalidValueException("Email id is required");
        }
        if (externalMessageId == null || externalMessageId.trim().isEmpty()) {
            throw new InvalidValueException("Email messageId is required");
        }
        if (subject == null) {
            throw new InvalidValueException("Email subject is required");
        }
        if (from == null) {
            throw new InvalidValueException("Email sender is required");
        }
        if (to == null || to.isEmpty()) {
            throw new InvalidValueException("Email must have at least one recipient");
        }
        if (content == null) {
            throw new InvalidValueException("Email content is required");
        }
        if (sentAt == null) {
            throw new InvalidValueException("Email sentAt is required");
        }
        this.id = id;
        this.externalMessageId = externalMessageId;
        this.subject = subject;
        this.from = from;
        this.to = List.copyOf(to);
        this.cc = cc == null ? List.of() : List.copyOf(cc);
        this.bcc = bcc == null ? List.of() : List.copyOf(bcc);
        this.content = content;
        this.sentAt = sentAt;
        this.attachments = attachments == null ? List.of() : List.copyOf(attachments);
        this.inReplyTo = inReplyTo == null || inReplyTo.isBlank() ? null : inReplyTo;
        this.references = references == null ? List.of() : List.copyOf(references);
        this.read = read;
        this.flagged = flagged;
        this.labels = normalizeLabels(labels);
    }

    private static Set<String> normalizeLabels(Collection<String> labels) {
        if (labels == null || labels.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> normalized = new TreeSet<>();
        for (String label : labels) {
            normalized.add(normalizeLabel(label));
        }
        return Collections.unmodifiableSet(normalized);
    }

    /**
     * Labels are compared lower-cased and trimmed
     */
    public static String normalizeLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidValueException("Label cannot be empty");
        }
        return label.trim().toLowerCase(Locale.ROOT);
    }

    public List<EmailAddress> allRecipients() {
        List<EmailAddress> recipients = new ArrayList<>(to.size() + cc.size() + bcc.size());
        recipients.addAll(to);
        recipients.addAll(cc);
        recipients.addAll(bcc);
        return recipients;
    }

    /**
     * Normalized addresses of the sender and every recipient
     */
    public Set<String> participantAddresses() {
        Set<String> participants = new LinkedHashSet<>();
        participants.add(from.normalized());
        for (EmailAddress recipient : allRecipients()) {
            participants.add(recipient.normalized());
        }
        return participants;
    }

    public boolean hasAttachments() {
        return !attachments.isEmpty();
    }

    public boolean isReply() {
        return inReplyTo != null;
    }

    public boolean hasLabel(String label) {
        return labels.contains(normalizeLabel(label));
    }

    public long totalAttachmentSize() {
        return attachments.stream().mapToLong(Attachment::sizeBytes).sum();
    }

    MailMessage withRead(boolean read) {
        return toBuilder().read(read).build();
    }

    MailMessage withFlagged(boolean flagged) {
        return toBuilder().flagged(flagged).build();
    }

    MailMessage withLabel(String label) {
        Set<String> updated = new TreeSet<>(labels);
        updated.add(normalizeLabel(label));
        return toBuilder().labels(updated).build();
    }

    MailMessage withoutLabel(String label) {
        Set<String> updated = new TreeSet<>(labels);
        updated.remove(normalizeLabel(label));
        return toBuilder().labels(updated).build();
    }
}
