package com.threadmail.mapper.row;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * THREAD_EVENT row, primary key (thread_id, version)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventRow {

    private String threadId;
    private long version;
    private String eventName;
    private String eventData;   // JSON payload
    private String occurredAt;
}
