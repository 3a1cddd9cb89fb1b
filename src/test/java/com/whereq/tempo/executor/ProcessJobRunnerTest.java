package com.whereq.tempo.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.exception.PermanentRunnerException;
import com.whereq.tempo.exception.TransientRunnerException;
import com.whereq.tempo.model.AcceleratorClass;
import com.whereq.tempo.scheduler.CooperativeCancellation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessJobRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TempoProperties properties;
    private CooperativeCancellation cancellation;

    @BeforeEach
    void setUp() {
        properties = new TempoProperties();
        cancellation = new CooperativeCancellation();
    }

    @Test
    void testPayloadGoesInAndJsonResultComesOut() throws Exception {
        ObjectNode payload = objectMapper.createObjectNode().put("script", "render.py").put("frames", 24);

        JsonNode result = runner("cat").run(payload, context());

        assertThat(result).isEqualTo(payload);
    }

    @Test
    void testJobEnvironmentIsExported() throws Exception {
        JsonNode result = runner("printf '\"%s/%s/%s\"' \"$TEMPO_JOB_ID\" \"$TEMPO_ATTEMPT\" \"$TEMPO_ACCELERATOR\"")
            .run(objectMapper.nullNode(), context());

        assertThat(result.asText()).isEqualTo("job-1/2/NONE");
    }

    @Test
    void testPlainTextOutputIsKeptAsString() throws Exception {
        JsonNode result = runner("echo rendered 24 frames").run(objectMapper.nullNode(), context());

        assertThat(result.isTextual()).isTrue();
        assertThat(result.asText()).isEqualTo("rendered 24 frames");
    }

    @Test
    void testConfiguredExitCodeIsPermanent() {
        assertThatThrownBy(() -> runner("echo 'bad payload' >&2; exit 2").run(objectMapper.nullNode(), context()))
            .isInstanceOf(PermanentRunnerException.class)
            .hasMessageContaining("exited with code 2")
            .hasMessageContaining("bad payload");
    }

    @Test
    void testOtherExitCodesAreTransient() {
        assertThatThrownBy(() -> runner("exit 75").run(objectMapper.nullNode(), context()))
            .isInstanceOf(TransientRunnerException.class)
            .hasMessageContaining("75");
    }

    @Test
    void testMissingCommandFailsPermanently() {
        ProcessJobRunner unconfigured = new ProcessJobRunner(properties, objectMapper);

        assertThat(unconfigured.isConfigured()).isFalse();
        assertThatThrownBy(() -> unconfigured.run(objectMapper.nullNode(), context()))
            .isInstanceOf(PermanentRunnerException.class);
    }

    @Test
    void testUnknownExecutableFailsPermanently() {
        properties.getRunner().setCommand(List.of("/definitely/not/here/tempo-runner"));

        assertThatThrownBy(() -> new ProcessJobRunner(properties, objectMapper).run(objectMapper.nullNode(), context()))
            .isInstanceOf(PermanentRunnerException.class);
    }

    @Test
    void testCancellationDestroysProcess() throws Exception {
        ProcessJobRunner runner = runner("sleep 30");
        CompletableFuture<Throwable> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                runner.run(objectMapper.nullNode(), context());
                return null;
            } catch (Exception e) {
                return e;
            }
        });

        Thread.sleep(300);
        cancellation.cancel("operator request");

        assertThat(outcome.get(10, TimeUnit.SECONDS))
            .isInstanceOf(CancellationException.class)
            .hasMessage("operator request");
    }

    private ProcessJobRunner runner(String script) {
        properties.getRunner().setCommand(List.of("sh", "-c", script));
        return new ProcessJobRunner(properties, objectMapper);
    }

    private JobContext context() {
        return JobContext.builder()
            .jobId("job-1")
            .attempt(2)
            .acceleratorClass(AcceleratorClass.NONE)
            .deadline(Instant.now().plusSeconds(60))
            .cancellation(cancellation)
            .build();
    }
}
