package com.modellifecycle.controller;

import com.modellifecycle.client.MlTrainingClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/ml")
@RequiredArgsConstructor
public class MlServiceController {

    private final MlTrainingClient mlTrainingClient;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> mlHealth() {
        return mlTrainingClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of("mlApi", healthy ? "UP" : "DOWN",
                                               "status", healthy ? "ok" : "degraded");
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }
}
