package com.whereq.scribe.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatsResponse {
    /**
     * Job ids waiting for a worker
     */
    private long pending;

    /**
     * Submissions are rejected at this size
     */
    private long maxSize;
}
