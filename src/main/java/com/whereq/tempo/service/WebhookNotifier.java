package com.whereq.tempo.service;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import com.whereq.tempo.scheduler.JobEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service for sending webhook notifications on terminal job states
 */
@Slf4j
@Service
public class WebhookNotifier implements JobEventListener {

    private final WebClient.Builder webClientBuilder;
    private final TempoProperties.NotificationsConfig config;

    @Autowired
    public WebhookNotifier(WebClient.Builder webClientBuilder, TempoProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.config = properties.getNotifications();
    }

    @Override
    public void onJobFinished(Job job, Duration executionTime) {
        if (config.shouldNotify(job.getState())) {
            notify(config.getWebhook(), job).subscribe();
        }
    }

    /**
     * Notify webhook about a job reaching a terminal state
     *
     * @param webhookUrl webhook URL
     * @param job job in its terminal state
     * @return Mono that completes when notification sent; never errors
     */
    public Mono<Void> notify(String webhookUrl, Job job) {
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(job))
            .retrieve()
            .toBodilessEntity()
            .timeout(config.getTimeout())
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                job.getId(), job.getState(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                job.getId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // a broken webhook never affects the job
            .then();
    }

    private Map<String, Object> buildPayload(Job job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("status", job.getState().name());
        payload.put("attempts", job.getAttemptCount());
        payload.put("timestamp", System.currentTimeMillis());

        if (job.getState() == JobState.COMPLETED && job.getResult() != null) {
            payload.put("result", job.getResult());
        } else if (job.getLastError() != null) {
            payload.put("error", job.getLastError());
        }
        return payload;
    }
}
