package com.threadmail.mapper.row;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentRow {

    private String attachmentId;
    private String messageId;
    private String filename;
    private String mimeType;
    private long sizeBytes;
    private String contentId;
    private int isInline;
}
