package com.whereq.tempo.resource;

import com.whereq.tempo.model.AcceleratorClass;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Detects GPUs through the vendor command line tools: {@code nvidia-smi -L}
 * for CUDA devices, {@code rocm-smi --showid} for ROCm devices.
 */
@Slf4j
public class CommandAcceleratorProbe implements AcceleratorProbe {

    private final Duration timeout;

    public CommandAcceleratorProbe(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public AcceleratorClass probe() {
        String nvidia = run(List.of("nvidia-smi", "-L"));
        if (nvidia != null && nvidia.contains("GPU")) {
            log.info("Detected CUDA accelerator: {}", nvidia.lines().findFirst().orElse(""));
            return AcceleratorClass.NVIDIA_CUDA;
        }

        String rocm = run(List.of("rocm-smi", "--showid"));
        if (rocm != null && rocm.contains("GPU")) {
            log.info("Detected ROCm accelerator");
            return AcceleratorClass.AMD_ROCM;
        }

        log.info("No accelerator detected");
        return AcceleratorClass.NONE;
    }

    /**
     * Run a discovery command, returning its output or null when it is missing, fails or hangs
     */
    private String run(List<String> command) {
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            log.debug("{} not available: {}", command.get(0), e.getMessage());
            return null;
        }

        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            Thread reader = new Thread(() -> copy(process.getInputStream(), output), "tempo-probe-" + command.get(0));
            reader.setDaemon(true);
            reader.start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} did not answer within {}, ignoring it", command.get(0), timeout);
                process.destroyForcibly();
                return null;
            }
            reader.join(timeout.toMillis());
            return process.exitValue() == 0 ? output.toString(StandardCharsets.UTF_8) : null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return null;
        }
    }

    private static void copy(InputStream in, ByteArrayOutputStream out) {
        try (in) {
            in.transferTo(out);
        } catch (IOException e) {
            log.debug("Failed to read probe output: {}", e.getMessage());
        }
    }
}
