package com.example.planetforge.controller;

import com.example.planetforge.kv.KvClient;
import com.example.planetforge.store.EvolutionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final EvolutionStore store;

    public HealthController(KvClient kvClient, EvolutionStore store) {
        this.kvClient = kvClient;
        this.store = store;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "planet-forge-engine");
        health.put("version", "0.1.0");

        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            store.listPlanets(1);
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}
