package com.whereq.tempo.resource;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads host capacity from the platform MXBean. On Linux the available memory
 * comes from MemAvailable in /proc/meminfo, which counts reclaimable page cache
 * that the MXBean's free memory leaves out.
 */
@Slf4j
public class OperatingSystemHostProbe implements HostProbe {

    private static final Path MEMINFO = Path.of("/proc/meminfo");

    private final com.sun.management.OperatingSystemMXBean osBean;

    public OperatingSystemHostProbe() {
        this.osBean = (com.sun.management.OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public int cpuCores() {
        return Runtime.getRuntime().availableProcessors();
    }

    @Override
    public long availableMemoryBytes() {
        long fromMeminfo = readMemAvailable();
        return fromMeminfo >= 0 ? fromMeminfo : osBean.getFreeMemorySize();
    }

    @Override
    public long totalMemoryBytes() {
        return osBean.getTotalMemorySize();
    }

    @Override
    public double systemLoadAverage() {
        return osBean.getSystemLoadAverage();
    }

    private long readMemAvailable() {
        if (!Files.isReadable(MEMINFO)) {
            return -1;
        }
        try {
            List<String> lines = Files.readAllLines(MEMINFO, StandardCharsets.US_ASCII);
            for (String line : lines) {
                if (line.startsWith("MemAvailable:")) {
                    String[] parts = line.trim().split("\\s+");
                    return Long.parseLong(parts[1]) * 1024L;
                }
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Could not read {}: {}", MEMINFO, e.getMessage());
        }
        return -1;
    }
}
