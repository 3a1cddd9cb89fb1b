package com.whereq.tempo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collection;

/**
 * Job counts per state
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatistics {
    private int total;
    private int pending;
    private int running;
    private int completed;
    private int failed;
    private int cancelled;

    public static QueueStatistics of(Collection<Job> jobs) {
        QueueStatistics stats = new QueueStatistics();
        for (Job job : jobs) {
            stats.total++;
            switch (job.getState()) {
                case PENDING -> stats.pending++;
                case RUNNING -> stats.running++;
                case COMPLETED -> stats.completed++;
                case FAILED -> stats.failed++;
                case CANCELLED -> stats.cancelled++;
            }
        }
        return stats;
    }

    /**
     * Nothing left for the scheduler to do
     */
    public boolean isDrained() {
        return pending == 0 && running == 0;
    }
}
