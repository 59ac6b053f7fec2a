package com.example.planetforge.controller;

import com.example.planetforge.auth.IdentityProvider;
import com.example.planetforge.model.EvolutionEvent;
import com.example.planetforge.model.Planet;
import com.example.planetforge.service.EvolutionEngine;
import com.example.planetforge.store.EvolutionStore;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Display reads. Values may lag the live stream by the cache TTL.
 */
@RestController
@RequestMapping("/api/planets")
public class PlanetController {

    static final int MAX_LIMIT = 100;

    private final IdentityProvider identityProvider;
    private final EvolutionEngine evolutionEngine;
    private final EvolutionStore store;

    public PlanetController(IdentityProvider identityProvider, EvolutionEngine evolutionEngine, EvolutionStore store) {
        this.identityProvider = identityProvider;
        this.evolutionEngine = evolutionEngine;
        this.store = store;
    }

    @GetMapping("/me")
    public Mono<ResponseEntity<Planet>> myPlanet(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return Mono.fromCallable(() -> {
            String userId = identityProvider.authenticate(authorization);
            return evolutionEngine.planetView(userId)
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.notFound().build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/me/events")
    public Mono<List<EvolutionEvent>> myEvents(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                               @RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> {
            String userId = identityProvider.authenticate(authorization);
            return evolutionEngine.recentEvents(userId, clamp(limit));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{planetId}")
    public Mono<ResponseEntity<Planet>> planet(@PathVariable String planetId) {
        return Mono.fromCallable(() -> store.loadPlanet(planetId)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<List<Planet>> list(@RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> evolutionEngine.listPlanets(clamp(limit)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    static int clamp(int limit) {
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }
}
