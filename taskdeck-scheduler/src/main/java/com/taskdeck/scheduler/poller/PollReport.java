package com.taskdeck.scheduler.poller;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one poll cycle, returned by the trigger endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollReport {
    private String message;
    private int processedCount;
    private int successCount;
    @Builder.Default
    private List<JobDispatch> results = new ArrayList<>();
    private Instant timestamp;

    /** Hand-off result of one selected job. */
    public record JobDispatch(String jobId, String title, boolean success, String error) {
    }
}
