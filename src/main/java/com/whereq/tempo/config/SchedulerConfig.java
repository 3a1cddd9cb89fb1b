package com.whereq.tempo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tempo.executor.JobRunner;
import com.whereq.tempo.executor.ProcessJobRunner;
import com.whereq.tempo.resource.AcceleratorProbe;
import com.whereq.tempo.resource.CommandAcceleratorProbe;
import com.whereq.tempo.resource.HostProbe;
import com.whereq.tempo.resource.OperatingSystemHostProbe;
import com.whereq.tempo.resource.ResourceMonitor;
import com.whereq.tempo.retry.RetryPolicy;
import com.whereq.tempo.scheduler.JobEventListener;
import com.whereq.tempo.scheduler.JobScheduler;
import com.whereq.tempo.store.FileTaskStore;
import com.whereq.tempo.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.List;

/**
 * Wiring of the scheduler and its collaborators. Every bean except the
 * scheduler itself can be replaced by declaring one of the same type.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    @ConditionalOnMissingBean
    public HostProbe hostProbe() {
        return new OperatingSystemHostProbe();
    }

    @Bean
    @ConditionalOnMissingBean
    public AcceleratorProbe acceleratorProbe(TempoProperties properties) {
        return new CommandAcceleratorProbe(properties.getResources().getAcceleratorProbeTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore(TempoProperties properties) {
        return new FileTaskStore(Paths.get(properties.getStore().getPath()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(TempoProperties properties) {
        return new RetryPolicy(properties);
    }

    @Bean
    @ConditionalOnMissingBean(JobRunner.class)
    public JobRunner jobRunner(TempoProperties properties, ObjectMapper objectMapper) {
        return new ProcessJobRunner(properties, objectMapper);
    }

    @Bean(destroyMethod = "close")
    public JobScheduler jobScheduler(TempoProperties properties, TaskStore taskStore, ResourceMonitor resourceMonitor,
                                     RetryPolicy retryPolicy, JobRunner jobRunner,
                                     List<JobEventListener> listeners) {
        JobScheduler scheduler = new JobScheduler(properties, taskStore, resourceMonitor, retryPolicy, jobRunner,
            listeners);
        if (properties.getScheduler().isAutoStart()) {
            scheduler.start();
        } else {
            log.info("Scheduler auto-start disabled (tempo.scheduler.auto-start=false)");
        }
        return scheduler;
    }
}
