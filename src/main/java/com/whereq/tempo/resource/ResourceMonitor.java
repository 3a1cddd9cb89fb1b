package com.whereq.tempo.resource;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.SchedulerConfigurationException;
import com.whereq.tempo.model.AcceleratorClass;
import com.whereq.tempo.model.ResourceBudget;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;

/**
 * Monitor host capacity and derive the worker budget.
 *
 * max_workers = max(1, min(available memory / per-job estimate,
 * cpu cores * oversubscription, hard cap)). Memory is usually the binding
 * constraint for media jobs; the floor of one keeps the queue moving on a
 * constrained host.
 */
@Slf4j
@Component
public class ResourceMonitor {

    private static final long MB = 1024L * 1024L;

    private final TempoProperties.ResourcesConfig config;
    private final HostProbe hostProbe;
    private final AcceleratorProbe acceleratorProbe;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private volatile AcceleratorClass acceleratorClass;
    private volatile ResourceBudget lastBudget;

    @Autowired
    public ResourceMonitor(TempoProperties properties, HostProbe hostProbe,
                           AcceleratorProbe acceleratorProbe, MeterRegistry meterRegistry) {
        this(properties, hostProbe, acceleratorProbe, meterRegistry, Clock.systemUTC());
    }

    public ResourceMonitor(TempoProperties properties, HostProbe hostProbe, AcceleratorProbe acceleratorProbe,
                           MeterRegistry meterRegistry, Clock clock) {
        this.config = properties.getResources();
        this.hostProbe = hostProbe;
        this.acceleratorProbe = acceleratorProbe;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("tempo.resources.workers.max", () -> lastBudget != null ? lastBudget.getMaxWorkers() : 0)
            .description("Worker budget from the last sample")
            .register(meterRegistry);

        Gauge.builder("tempo.resources.memory.available", () -> hostProbe.availableMemoryBytes() / (double) MB)
            .description("Available host memory in MB")
            .register(meterRegistry);

        Gauge.builder("tempo.resources.cpu.cores", hostProbe::cpuCores)
            .description("CPU cores usable by the scheduler")
            .register(meterRegistry);

        AcceleratorClass accelerator = acceleratorClass();

        log.info("ResourceMonitor initialized: per-job memory={} MB, hard cap={}, cpu oversubscription={}, accelerator={}",
            config.getPerJobMemoryMb(), config.getHardWorkerCap(), config.getCpuOversubscription(), accelerator);
    }

    /**
     * Compute the current worker budget
     *
     * @return budget with max_workers >= 1
     */
    public ResourceBudget sample() {
        int cpuCores = Math.max(0, hostProbe.cpuCores());
        long availableMb = Math.max(0L, hostProbe.availableMemoryBytes()) / MB;
        long totalMb = Math.max(0L, hostProbe.totalMemoryBytes()) / MB;

        int workersByMemory = (int) Math.min(Integer.MAX_VALUE, availableMb / config.getPerJobMemoryMb());
        int workersByCpu = (int) Math.floor(cpuCores * config.getCpuOversubscription());
        int hardCap = config.getHardWorkerCap();

        int maxWorkers = Math.max(1, Math.min(workersByMemory, Math.min(workersByCpu, hardCap)));

        if (workersByMemory < 1 || workersByCpu < 1) {
            log.debug("Low resources (memory allows {}, cpu allows {}), degrading to a single worker",
                workersByMemory, workersByCpu);
        }

        ResourceBudget budget = ResourceBudget.builder()
            .maxWorkers(maxWorkers)
            .acceleratorClass(acceleratorClass())
            .cpuCores(cpuCores)
            .availableMemoryMb(availableMb)
            .totalMemoryMb(totalMb)
            .workersByMemory(workersByMemory)
            .workersByCpu(workersByCpu)
            .hardCap(hardCap)
            .sampledAt(clock.instant())
            .build();

        ResourceBudget previous = lastBudget;
        if (previous == null || previous.getMaxWorkers() != maxWorkers) {
            log.info("Worker budget is now {} (memory: {} MB free → {}, cpu: {} cores → {}, cap: {})",
                maxWorkers, availableMb, workersByMemory, cpuCores, workersByCpu, hardCap);
        }
        lastBudget = budget;
        return budget;
    }

    /**
     * Accelerator class, discovered on first use and cached
     */
    public AcceleratorClass acceleratorClass() {
        AcceleratorClass cached = acceleratorClass;
        if (cached == null) {
            synchronized (this) {
                if (acceleratorClass == null) {
                    acceleratorClass = resolveAccelerator();
                }
                cached = acceleratorClass;
            }
        }
        return cached;
    }

    public ResourceBudget getLastBudget() {
        return lastBudget;
    }

    /**
     * Periodic resource alerting
     */
    @Scheduled(fixedRateString = "${tempo.resources.monitor.poll-interval:PT5S}")
    public void monitorResources() {
        long availableMb = hostProbe.availableMemoryBytes() / MB;
        long threshold = config.getMonitor().getMemoryAlertThresholdMb();

        if (availableMb < threshold) {
            log.warn("LOW MEMORY: {} MB available (threshold: {} MB)", availableMb, threshold);
        }

        double load = hostProbe.systemLoadAverage();
        int cores = hostProbe.cpuCores();
        if (load > cores) {
            log.warn("HIGH CPU LOAD: load average {} on {} cores", String.format(Locale.ROOT, "%.2f", load), cores);
        }
    }

    /**
     * Get current resource availability summary
     */
    public String getResourceSummary() {
        ResourceBudget budget = lastBudget != null ? lastBudget : sample();
        return String.format(Locale.ROOT, "Workers: %d (memory %d MB free → %d, cpu %d cores → %d, cap %d), accelerator: %s",
            budget.getMaxWorkers(), budget.getAvailableMemoryMb(), budget.getWorkersByMemory(),
            budget.getCpuCores(), budget.getWorkersByCpu(), budget.getHardCap(), budget.getAcceleratorClass());
    }

    private AcceleratorClass resolveAccelerator() {
        String configured = config.getAccelerator();
        if (configured == null || configured.isBlank() || configured.equalsIgnoreCase("auto")) {
            return acceleratorProbe.probe();
        }
        try {
            return AcceleratorClass.valueOf(configured.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new SchedulerConfigurationException("Unknown tempo.resources.accelerator: " + configured, e);
        }
    }
}
