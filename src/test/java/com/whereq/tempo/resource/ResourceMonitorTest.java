package com.whereq.tempo.resource;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.SchedulerConfigurationException;
import com.whereq.tempo.model.AcceleratorClass;
import com.whereq.tempo.model.ResourceBudget;
import com.whereq.tempo.support.FixedHostProbe;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResourceMonitorTest {

    @Mock
    private AcceleratorProbe acceleratorProbe;

    private TempoProperties properties;
    private FixedHostProbe hostProbe;
    private SimpleMeterRegistry meterRegistry;
    private ResourceMonitor monitor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(acceleratorProbe.probe()).thenReturn(AcceleratorClass.NONE);

        properties = new TempoProperties();
        properties.getResources().setPerJobMemoryMb(2048);
        properties.getResources().setHardWorkerCap(8);
        hostProbe = new FixedHostProbe(16, 16 * 1024);
        meterRegistry = new SimpleMeterRegistry();
        monitor = new ResourceMonitor(properties, hostProbe, acceleratorProbe, meterRegistry);
    }

    @Test
    void testMemoryIsTheBindingConstraint() {
        hostProbe.setAvailableMemoryMb(6 * 1024);

        ResourceBudget budget = monitor.sample();

        assertThat(budget.getWorkersByMemory()).isEqualTo(3);
        assertThat(budget.getWorkersByCpu()).isEqualTo(16);
        assertThat(budget.getMaxWorkers()).isEqualTo(3);
    }

    @Test
    void testCpuIsTheBindingConstraint() {
        hostProbe.setCpuCores(2);

        assertThat(monitor.sample().getMaxWorkers()).isEqualTo(2);
    }

    @Test
    void testOversubscriptionScalesCpuLimit() {
        hostProbe.setCpuCores(2);
        properties.getResources().setCpuOversubscription(2.0);

        assertThat(monitor.sample().getMaxWorkers()).isEqualTo(4);
    }

    @Test
    void testHardCapLimitsLargeHosts() {
        hostProbe.setCpuCores(64);
        hostProbe.setAvailableMemoryMb(512 * 1024);

        assertThat(monitor.sample().getMaxWorkers()).isEqualTo(8);
    }

    @Test
    void testStarvedHostStillGetsOneWorker() {
        hostProbe.setAvailableMemoryMb(500);
        hostProbe.setCpuCores(0);

        ResourceBudget budget = monitor.sample();

        assertThat(budget.getWorkersByMemory()).isZero();
        assertThat(budget.getMaxWorkers()).isEqualTo(1);
    }

    @Test
    void testBudgetFollowsHostChanges() {
        hostProbe.setAvailableMemoryMb(8 * 1024);
        assertThat(monitor.sample().getMaxWorkers()).isEqualTo(4);

        hostProbe.setAvailableMemoryMb(2 * 1024);
        assertThat(monitor.sample().getMaxWorkers()).isEqualTo(1);
        assertThat(monitor.getLastBudget().getMaxWorkers()).isEqualTo(1);
    }

    @Test
    void testAcceleratorIsProbedOnce() {
        when(acceleratorProbe.probe()).thenReturn(AcceleratorClass.NVIDIA_CUDA);

        monitor.sample();
        monitor.sample();
        monitor.sample();

        assertThat(monitor.acceleratorClass()).isEqualTo(AcceleratorClass.NVIDIA_CUDA);
        assertThat(monitor.sample().getAcceleratorClass()).isEqualTo(AcceleratorClass.NVIDIA_CUDA);
        verify(acceleratorProbe, times(1)).probe();
    }

    @Test
    void testConfiguredAcceleratorSkipsProbe() {
        properties.getResources().setAccelerator("amd-rocm");

        assertThat(monitor.acceleratorClass()).isEqualTo(AcceleratorClass.AMD_ROCM);
        verify(acceleratorProbe, never()).probe();
    }

    @Test
    void testUnknownAcceleratorIsAConfigurationError() {
        properties.getResources().setAccelerator("tpu");

        assertThatThrownBy(() -> monitor.acceleratorClass())
            .isInstanceOf(SchedulerConfigurationException.class)
            .hasMessageContaining("tpu");
    }

    @Test
    void testGaugesAreRegistered() {
        monitor.initialize();
        monitor.sample();

        assertThat(meterRegistry.get("tempo.resources.workers.max").gauge().value()).isEqualTo(8.0);
        assertThat(meterRegistry.get("tempo.resources.cpu.cores").gauge().value()).isEqualTo(16.0);
        assertThat(meterRegistry.get("tempo.resources.memory.available").gauge().value()).isEqualTo(16 * 1024.0);
    }

    @Test
    void testResourceSummaryMentionsBudget() {
        monitor.sample();

        assertThat(monitor.getResourceSummary()).contains("Workers: 8").contains("accelerator: NONE");
    }
}
