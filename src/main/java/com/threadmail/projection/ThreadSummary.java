package com.threadmail.projection;

import java.time.Instant;
import java.util.Set;

/**
 * Inbox row for one thread
 */
public record ThreadSummary(String threadId,
                            String subject,
                            Set<String> participants,
                            int messageCount,
                            int unreadCount,
                            boolean archived,
                            boolean muted,
                            Instant lastActivityAt,
                            String latestPreview,
                            long version) {
}
