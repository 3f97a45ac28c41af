package com.threadmail.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.threadmail.domain.Attachment;
import com.threadmail.domain.Content;
import com.threadmail.domain.EmailAddress;
import com.threadmail.domain.MailMessage;
import com.threadmail.domain.Subject;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Jackson based JSON codec for thread events and message snapshots
 * - Event payload: the event's audit data plus the message snapshot where one is carried
 * - Envelope: payload wrapped with threadId/version/eventName/occurredAt (JMS wire)
 * - Address and string lists stored in single DB columns
 */
public final class ThreadJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ThreadJson() {}

    // ---- Events ----

    /**
     * Serialize the name-specific payload of an event
     */
    public static String encodeEvent(ThreadEvent event) {
        ObjectNode payload = MAPPER.valueToTree(event.eventData());
        if (event instanceof ThreadCreated created) {
            payload.set("message", writeMessage(created.foundingMessage()));
        } else if (event instanceof MessageAdded added) {
            payload.set("message", writeMessage(added.message()));
        }
        return write(payload);
    }

    /**
     * Rebuild a typed event from its stored columns
     */
    public static ThreadEvent decodeEvent(String threadId, long version, Instant occurredAt,
                                          String eventName, String payloadJson) {
        JsonNode data = read(payloadJson);
        switch (eventName) {
            case ThreadCreated.NAME:
                return new ThreadCreated(threadId, version, occurredAt,
                        new Subject(text(data, "subject")), readMessage(data.path("message")));
            case MessageAdded.NAME:
                return new MessageAdded(threadId, version, occurredAt, readMessage(data.path("message")));
            case MessageRemoved.NAME:
                return new MessageRemoved(threadId, version, occurredAt, text(data, "messageId"));
            case ThreadMarkedRead.NAME:
                return new ThreadMarkedRead(threadId, version, occurredAt, readStrings(data.path("messageIds")));
            case ThreadArchived.NAME:
                return new ThreadArchived(threadId, version, occurredAt);
            case ThreadUnarchived.NAME:
                return new ThreadUnarchived(threadId, version, occurredAt);
            case ThreadMuted.NAME:
                return new ThreadMuted(threadId, version, occurredAt);
            case ThreadUnmuted.NAME:
                return new ThreadUnmuted(threadId, version, occurredAt);
            case MessageMarkedRead.NAME:
                return new MessageMarkedRead(threadId, version, occurredAt, text(data, "messageId"));
            case MessageMarkedUnread.NAME:
                return new MessageMarkedUnread(threadId, version, occurredAt, text(data, "messageId"));
            case MessageFlagged.NAME:
                return new MessageFlagged(threadId, version, occurredAt, text(data, "messageId"));
            case MessageUnflagged.NAME:
                return new MessageUnflagged(threadId, version, occurredAt, text(data, "messageId"));
            case MessageLabelAdded.NAME:
                return new MessageLabelAdded(threadId, version, occurredAt,
                        text(data, "messageId"), text(data, "label"));
            case MessageLabelRemoved.NAME:
                return new MessageLabelRemoved(threadId, version, occurredAt,
                        text(data, "messageId"), text(data, "label"));
            default:
                throw new IllegalArgumentException("Unknown thread event: " + eventName);
        }
    }

    public static String toEnvelope(ThreadEvent event) {
        ObjectNode envelope = MAPPER.createObjectNode();
        envelope.put("threadId", event.threadId());
        envelope.put("version", event.version());
        envelope.put("eventName", event.eventName());
        envelope.put("occurredAt", event.occurredAt().toString());
        envelope.set("data", read(encodeEvent(event)));
        return write(envelope);
    }

    public static ThreadEvent fromEnvelope(String json) {
        JsonNode envelope = read(json);
        return decodeEvent(
                text(envelope, "threadId"),
                envelope.path("version").asLong(),
                Instant.parse(text(envelope, "occurredAt")),
                text(envelope, "eventName"),
                write(envelope.path("data")));
    }

    // ---- Messages ----

    public static ObjectNode writeMessage(MailMessage message) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", message.getId());
        node.put("externalMessageId", message.getExternalMessageId());
        node.put("subject", message.getSubject().raw());
        node.set("from", writeAddress(message.getFrom()));
        node.set("to", writeAddressArray(message.getTo()));
        node.set("cc", writeAddressArray(message.getCc()));
        node.set("bcc", writeAddressArray(message.getBcc()));
        node.put("plainText", message.getContent().plainText());
        node.put("html", message.getContent().html());
        node.put("sentAt", message.getSentAt().toString());
        ArrayNode attachments = node.putArray("attachments");
        for (Attachment attachment : message.getAttachments()) {
            ObjectNode item = attachments.addObject();
            item.put("id", attachment.id());
            item.put("filename", attachment.filename());
            item.put("mimeType", attachment.mimeType());
            item.put("sizeBytes", attachment.sizeBytes());
            item.put("contentId", attachment.contentId());
            item.put("inline", attachment.inline());
        }
        node.put("inReplyTo", message.getInReplyTo());
        node.set("references", MAPPER.valueToTree(message.getReferences()));
        node.put("read", message.isRead());
        node.put("flagged", message.isFlagged());
        node.set("labels", MAPPER.valueToTree(message.getLabels()));
        return node;
    }

    public static MailMessage readMessage(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Message snapshot missing from event payload");
        }
        List<Attachment> attachments = new ArrayList<>();
        for (JsonNode item : node.path("attachments")) {
            attachments.add(new Attachment(
                    text(item, "id"),
                    text(item, "filename"),
                    text(item, "mimeType"),
                    item.path("sizeBytes").asLong(),
                    text(item, "contentId"),
                    item.path("inline").asBoolean()));
        }
        return MailMessage.builder()
                .id(text(node, "id"))
                .externalMessageId(text(node, "externalMessageId"))
                .subject(new Subject(text(node, "subject")))
                .from(readAddress(node.path("from")))
                .to(readAddressArray(node.path("to")))
                .cc(readAddressArray(node.path("cc")))
                .bcc(readAddressArray(node.path("bcc")))
                .content(new Content(text(node, "plainText"), text(node, "html")))
                .sentAt(Instant.parse(text(node, "sentAt")))
                .attachments(attachments)
                .inReplyTo(text(node, "inReplyTo"))
                .references(readStrings(node.path("references")))
                .read(node.path("read").asBoolean())
                .flagged(node.path("flagged").asBoolean())
                .labels(new LinkedHashSet<>(readStrings(node.path("labels"))))
                .build();
    }

    // ---- Column helpers ----

    public static String writeAddresses(List<EmailAddress> addresses) {
        return write(writeAddressArray(addresses));
    }

    public static List<EmailAddress> readAddresses(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return readAddressArray(read(json));
    }

    public static String writeStrings(Collection<String> values) {
        return write(MAPPER.valueToTree(values));
    }

    public static List<String> readStrings(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return readStrings(read(json));
    }

    public static Set<String> readStringSet(String json) {
        return new LinkedHashSet<>(readStrings(json));
    }

    // ---- Internals ----

    private static ObjectNode writeAddress(EmailAddress address) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("address", address.address());
        node.put("displayName", address.displayName());
        return node;
    }

    private static ArrayNode writeAddressArray(List<EmailAddress> addresses) {
        ArrayNode array = MAPPER.createArrayNode();
        for (EmailAddress address : addresses) {
            array.add(writeAddress(address));
        }
        return array;
    }

    private static EmailAddress readAddress(JsonNode node) {
        return new EmailAddress(text(node, "address"), text(node, "displayName"));
    }

    private static List<EmailAddress> readAddressArray(JsonNode array) {
        List<EmailAddress> addresses = new ArrayList<>();
        for (JsonNode node : array) {
            addresses.add(readAddress(node));
        }
        return addresses;
    }

    private static List<String> readStrings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode node : array) {
            values.add(node.asText());
        }
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode read(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
