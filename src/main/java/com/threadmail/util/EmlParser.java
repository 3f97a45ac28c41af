package com.threadmail.util;

import com.threadmail.domain.Attachment;
import com.threadmail.domain.Content;
import com.threadmail.domain.EmailAddress;
import com.threadmail.domain.InvalidValueException;
import com.threadmail.domain.MailMessage;
import com.threadmail.domain.Subject;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimePart;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

/**
 * EML parsing utilities based on Jakarta Mail
 * - Raw RFC 822 bytes to {@link MailMessage}
 * - Threading headers (Message-ID, In-Reply-To, References)
 * - text/plain and text/html bodies, attachments and inline parts
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws MessagingException, IOException {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Parse raw EML into a new, unread message snapshot with a generated id.
     * A missing Date header falls back to the clock's current instant.
     */
    public static MailMessage toMailMessage(byte[] emlData, Clock clock) throws MessagingException, IOException {
        MimeMessage mimeMessage = parse(emlData);

        BodyCollector body = new BodyCollector();
        body.collect(mimeMessage);

        Instant sentAt = mimeMessage.getSentDate() != null
                ? mimeMessage.getSentDate().toInstant()
                : clock.instant();

        return MailMessage.builder()
                .id(UUID.randomUUID().toString())
                .externalMessageId(extractMessageId(mimeMessage))
                .subject(new Subject(extractSubject(mimeMessage)))
                .from(extractSender(mimeMessage))
                .to(extractRecipients(mimeMessage, Message.RecipientType.TO))
                .cc(extractRecipients(mimeMessage, Message.RecipientType.CC))
                .bcc(extractRecipients(mimeMessage, Message.RecipientType.BCC))
                .content(body.toContent())
                .sentAt(sentAt)
                .attachments(body.attachments)
                .inReplyTo(extractInReplyTo(mimeMessage))
                .references(extractReferences(mimeMessage))
                .build();
    }

    /**
     * Extract Message-ID from a MimeMessage
     */
    public static String extractMessageId(MimeMessage message) throws MessagingException {
        String messageId = message.getMessageID();
        if (messageId == null || messageId.isBlank()) {
            messageId = "<" + System.currentTimeMillis() + "." + UUID.randomUUID() + "@threadmail>";
        }
        return messageId.trim();
    }

    /**
     * Extract Subject from a MimeMessage
     */
    public static String extractSubject(MimeMessage message) throws MessagingException {
        String subject = message.getSubject();
        return subject != null && !subject.isBlank() ? subject : "(No Subject)";
    }

    /**
     * Extract sender from a MimeMessage
     */
    public static EmailAddress extractSender(MimeMessage message) throws MessagingException {
        Address[] from = message.getFrom();
        if (from == null || from.length == 0) {
            throw new InvalidValueException("Message has no From address");
        }
        return toEmailAddress(from[0]);
    }

    public static String extractInReplyTo(MimeMessage message) throws MessagingException {
        String inReplyTo = message.getHeader("In-Reply-To", null);
        if (inReplyTo == null || inReplyTo.isBlank()) {
            return null;
        }
        // Some clients append a comment after the id
        return inReplyTo.trim().split("\\s+")[0];
    }

    /**
     * References header, one id per whitespace-separated token
     */
    public static List<String> extractReferences(MimeMessage message) throws MessagingException {
        String references = message.getHeader("References", " ");
        if (references == null || references.isBlank()) {
            return List.of();
        }
        return Arrays.asList(references.trim().split("\\s+"));
    }

    private static List<EmailAddress> extractRecipients(MimeMessage message, Message.RecipientType type)
            throws MessagingException {
        Address[] addresses = message.getRecipients(type);
        List<EmailAddress> result = new ArrayList<>();
        if (addresses == null) {
            return result;
        }
        for (Address address : addresses) {
            try {
                result.add(toEmailAddress(address));
            } catch (InvalidValueException e) {
                log.warn("Skipping unusable {} recipient: {}", type, address);
            }
        }
        return result;
    }

    private static EmailAddress toEmailAddress(Address address) {
        if (address instanceof InternetAddress internetAddress) {
            return new EmailAddress(internetAddress.getAddress(), internetAddress.getPersonal());
        }
        return new EmailAddress(address.toString());
    }

    /**
     * Walks the MIME tree once, keeping the first text bodies and every attachment
     */
    private static final class BodyCollector {

        private String plainText;
        private String html;
        private final List<Attachment> attachments = new ArrayList<>();

        void collect(Part part) throws MessagingException, IOException {
            String filename = part.getFileName();
            String disposition = part.getDisposition();
            boolean attachment = Part.ATTACHMENT.equalsIgnoreCase(disposition)
                    || (filename != null && !part.isMimeType("multipart/*"));

            if (attachment) {
                attachments.add(toAttachment(part, filename, disposition));
            } else if (part.isMimeType("multipart/*")) {
                Multipart multipart = (Multipart) part.getContent();
                for (int i = 0; i < multipart.getCount(); i++) {
                    collect(multipart.getBodyPart(i));
                }
            } else if (part.isMimeType("text/plain") && plainText == null) {
                plainText = String.valueOf(part.getContent());
            } else if (part.isMimeType("text/html") && html == null) {
                html = String.valueOf(part.getContent());
            }
        }

        Content toContent() {
            String text = plainText;
            if ((text == null || text.isBlank()) && html != null) {
                text = htmlToText(html);
            }
            if (text == null || text.isBlank()) {
                text = "(No Content)";
            }
            return new Content(text, html);
        }

        // style and script bodies are data nodes, text() skips them
        static String htmlToText(String html) {
            return Jsoup.parse(html).text()
                    .replace('\u00A0', ' ')
                    .replaceAll("\\s+", " ")
                    .trim();
        }

        private static Attachment toAttachment(Part part, String filename, String disposition)
                throws MessagingException, IOException {
            String mimeType = new ContentType(part.getContentType()).getBaseType().toLowerCase();
            long size = part.getSize();
            if (size < 0) {
                try (InputStream is = part.getInputStream()) {
                    size = is.readAllBytes().length;
                }
            }
            String contentId = part instanceof MimePart mimePart ? mimePart.getContentID() : null;
            return new Attachment(
                    UUID.randomUUID().toString(),
                    filename != null ? filename : "attachment",
                    mimeType,
                    size,
                    contentId,
                    Part.INLINE.equalsIgnoreCase(disposition));
        }
    }
}
