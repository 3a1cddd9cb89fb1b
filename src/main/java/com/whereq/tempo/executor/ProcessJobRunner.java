package com.whereq.tempo.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.PermanentRunnerException;
import com.whereq.tempo.exception.TransientRunnerException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Runs each job as an external process.
 *
 * The payload JSON is written to the process's stdin and its stdout is
 * parsed as the JSON result (plain text is kept as a string). Exit code 0 is
 * success; configured exit codes are permanent failures; anything else is
 * transient. Cancellation destroys the process.
 *
 * @author WhereQ Inc.
 */
@Slf4j
public class ProcessJobRunner implements JobRunner {

    private static final int ERROR_TAIL_CHARS = 2000;

    private final TempoProperties.RunnerConfig config;
    private final ObjectMapper objectMapper;

    public ProcessJobRunner(TempoProperties properties, ObjectMapper objectMapper) {
        this.config = properties.getRunner();
        this.objectMapper = objectMapper;
        if (!isConfigured()) {
            log.warn("tempo.runner.command is not set; every job will fail until a runner command is configured");
        }
    }

    public boolean isConfigured() {
        return config.getCommand() != null && !config.getCommand().isEmpty();
    }

    @Override
    public JsonNode run(JsonNode payload, JobContext context) throws Exception {
        if (!isConfigured()) {
            throw new PermanentRunnerException("No runner command configured (tempo.runner.command)");
        }
        List<String> command = new ArrayList<>(config.getCommand());
        log.info("Executing job {} (attempt {}): {}", context.getJobId(), context.getAttempt(), String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        if (config.getWorkingDirectory() != null) {
            processBuilder.directory(new File(config.getWorkingDirectory()));
        }
        processBuilder.environment().put("TEMPO_JOB_ID", context.getJobId());
        processBuilder.environment().put("TEMPO_ATTEMPT", String.valueOf(context.getAttempt()));
        processBuilder.environment().put("TEMPO_ACCELERATOR", String.valueOf(context.getAcceleratorClass()));

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            throw new PermanentRunnerException("Cannot start runner command " + command.get(0), e);
        }
        context.getCancellation().onCancel(process::destroy);

        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        Thread stderrReader = new Thread(() -> drain(process.getErrorStream(), stderr),
            "tempo-runner-stderr-" + context.getJobId());
        stderrReader.setDaemon(true);
        stderrReader.start();

        String stdout;
        int exitCode;
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(objectMapper.writeValueAsBytes(payload));
            } catch (IOException e) {
                // process exited before reading its input; the exit code tells the rest
                log.debug("Job {} runner closed stdin early: {}", context.getJobId(), e.getMessage());
            }

            try (InputStream out = process.getInputStream()) {
                stdout = new String(out.readAllBytes(), StandardCharsets.UTF_8);
            }
            exitCode = process.waitFor();
            stderrReader.join(1000);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CancellationException("Job " + context.getJobId() + " interrupted");
        }

        if (context.getCancellation().isCancelled()) {
            throw new CancellationException(context.getCancellation().reason());
        }

        if (exitCode == 0) {
            log.info("Job {} runner exited successfully", context.getJobId());
            return parseResult(stdout);
        }

        String message = "Runner exited with code " + exitCode + tail(stderr.toString(StandardCharsets.UTF_8));
        if (config.getPermanentExitCodes() != null && config.getPermanentExitCodes().contains(exitCode)) {
            throw new PermanentRunnerException(message);
        }
        throw new TransientRunnerException(message);
    }

    private JsonNode parseResult(String stdout) {
        String trimmed = stdout.trim();
        if (trimmed.isEmpty()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(trimmed);
        }
    }

    private static String tail(String stderr) {
        String trimmed = stderr.trim();
        if (trimmed.isEmpty()) {
            return "";
        }
        if (trimmed.length() > ERROR_TAIL_CHARS) {
            trimmed = trimmed.substring(trimmed.length() - ERROR_TAIL_CHARS);
        }
        return "\n" + trimmed;
    }

    private static void drain(InputStream in, ByteArrayOutputStream out) {
        try (in) {
            in.transferTo(out);
        } catch (IOException e) {
            log.debug("Failed to read runner stderr: {}", e.getMessage());
        }
    }
}
