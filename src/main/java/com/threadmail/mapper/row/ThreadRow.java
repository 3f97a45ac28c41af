package com.threadmail.mapper.row;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MAIL_THREAD row
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadRow {

    private String threadId;
    private String subject;
    private String normalizedSubject;   // Lower-cased, Re:/Fwd: stripped; lookup key
    private int isArchived;
    private int isMuted;
    private int messageCount;
    private int participantCount;
    private String lastActivityAt;      // ISO-8601 instant
    private String createdAt;
    private long version;
}
