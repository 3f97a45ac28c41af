package com.threadmail.domain;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a candidate message belongs to one concrete thread.
 * Rules are tried in order and the first hit wins:
 * <ol>
 *   <li>normalized subjects are equal, ignoring case</li>
 *   <li>the candidate's References header names a message of the thread</li>
 *   <li>the candidate's In-Reply-To header names a message of the thread</li>
 * </ol>
 * Stateless; the result depends only on the two arguments.
 */
public final class ThreadingMatcher {

    public enum MatchReason {
        SUBJECT,
        REFERENCES,
        IN_REPLY_TO,
        NONE
    }

    private ThreadingMatcher() {}

    public static boolean matches(MailThread thread, MailMessage candidate) {
        return evaluate(thread, candidate) != MatchReason.NONE;
    }

    public static MatchReason evaluate(MailThread thread, MailMessage candidate) {
        if (thread.getSubject().sameConversationAs(candidate.getSubject())) {
            return MatchReason.SUBJECT;
        }

        Set<String> threadMessageIds = thread.externalMessageIds();

        List<String> references = candidate.getReferences();
        if (!references.isEmpty() && references.stream().anyMatch(threadMessageIds::contains)) {
            return MatchReason.REFERENCES;
        }

        String inReplyTo = candidate.getInReplyTo();
        if (inReplyTo != null && threadMessageIds.contains(inReplyTo)) {
            return MatchReason.IN_REPLY_TO;
        }
        return MatchReason.NONE;
    }
}
