package com.forecastplatform.orchestrator.controller;

import com.forecastplatform.common.model.ForecastRun;
import com.forecastplatform.common.model.RunSummary;
import com.forecastplatform.orchestrator.dto.CreateForecastRequest;
import com.forecastplatform.orchestrator.dto.ScenarioForecastRequest;
import com.forecastplatform.orchestrator.service.ForecastRunLauncher;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/forecasts")
public class ForecastController {

    private final ForecastRunLauncher launcher;

    public ForecastController(ForecastRunLauncher launcher) {
        this.launcher = launcher;
    }

    @PostMapping
    public Mono<ResponseEntity<ForecastRun>> create(
            @RequestBody CreateForecastRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String userId) {
        return launcher.createAndRun(userId, request)
            .map(run -> ResponseEntity.status(HttpStatus.ACCEPTED).body(run));
    }

    @PostMapping("/scenario")
    public Mono<ResponseEntity<ForecastRun>> createScenario(
            @RequestBody ScenarioForecastRequest request,
            @RequestHeader(value = "X-User-Id", defaultValue = "system") String userId) {
        return launcher.createAndRunScenario(userId, request)
            .map(run -> ResponseEntity.status(HttpStatus.ACCEPTED).body(run));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<RunSummary>> summary(@PathVariable("id") long id) {
        return launcher.getSummary(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
