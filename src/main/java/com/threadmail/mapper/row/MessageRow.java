package com.threadmail.mapper.row;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * THREAD_MESSAGE row. Address and id lists are JSON arrays.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRow {

    private String messageId;
    private String threadId;
    private String externalMessageId;
    private String subject;
    private String fromAddress;
    private String fromName;
    private String toAddresses;
    private String ccAddresses;
    private String bccAddresses;
    private String contentPlain;
    private String contentHtml;
    private String sentAt;
    private String inReplyTo;
    private String referenceIds;
    private int isRead;
    private int isFlagged;
    private String labels;
}
