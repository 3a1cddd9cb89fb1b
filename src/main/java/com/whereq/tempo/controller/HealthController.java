package com.whereq.tempo.controller;

import com.whereq.tempo.model.QueueStatistics;
import com.whereq.tempo.model.ResourceBudget;
import com.whereq.tempo.scheduler.JobScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and scheduler status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private JobScheduler scheduler;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service and the scheduler are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(() -> {
                    ResourceBudget budget = scheduler.currentBudget();
                    QueueStatistics stats = scheduler.statistics();

                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-tempo");

                    Map<String, Object> schedulerInfo = new HashMap<>();
                    schedulerInfo.put("status", scheduler.isRunning() ? "RUNNING" : "STOPPED");
                    schedulerInfo.put("running", scheduler.runningCount());
                    schedulerInfo.put("maxWorkers", budget.getMaxWorkers());
                    schedulerInfo.put("accelerator", budget.getAcceleratorClass());
                    schedulerInfo.put("pending", stats.getPending());
                    schedulerInfo.put("failed", stats.getFailed());

                    health.put("scheduler", schedulerInfo);
                    return ResponseEntity.ok(health);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    Map<String, Object> health = new HashMap<>();
                    health.put("status", "UP");
                    health.put("service", "whereq-tempo");

                    Map<String, String> schedulerInfo = new HashMap<>();
                    schedulerInfo.put("status", "ERROR");
                    schedulerInfo.put("error", e.getMessage());
                    health.put("scheduler", schedulerInfo);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }
}
