package com.whereq.tempo.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable representation of every job, keyed by id in insertion order
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueSnapshot {
    public static final int CURRENT_VERSION = 1;

    /**
     * On-disk schema version
     */
    private int version = CURRENT_VERSION;

    private LinkedHashMap<String, Job> jobs = new LinkedHashMap<>();

    public static QueueSnapshot empty() {
        return new QueueSnapshot();
    }

    public QueueSnapshot copy() {
        LinkedHashMap<String, Job> copied = new LinkedHashMap<>();
        for (Map.Entry<String, Job> entry : jobs.entrySet()) {
            copied.put(entry.getKey(), entry.getValue().copy());
        }
        return new QueueSnapshot(version, copied);
    }
}
