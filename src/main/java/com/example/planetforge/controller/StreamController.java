package com.example.planetforge.controller;

import com.example.planetforge.auth.IdentityProvider;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.StreamResult;
import com.example.planetforge.service.BackgroundWorkQueue;
import com.example.planetforge.service.SessionManager;
import com.example.planetforge.service.StreamAnalysisService;
import com.example.planetforge.stream.ConnectionRegistry;
import com.example.planetforge.stream.MessageCodec;
import com.example.planetforge.stream.message.CodeStreamMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/stream")
public class StreamController {

    private final IdentityProvider identityProvider;
    private final StreamAnalysisService analysisService;
    private final SessionManager sessionManager;
    private final ConnectionRegistry registry;
    private final BackgroundWorkQueue workQueue;
    private final MessageCodec codec;
    private final Clock clock;

    public StreamController(IdentityProvider identityProvider, StreamAnalysisService analysisService,
                            SessionManager sessionManager, ConnectionRegistry registry,
                            BackgroundWorkQueue workQueue, MessageCodec codec, Clock clock) {
        this.identityProvider = identityProvider;
        this.analysisService = analysisService;
        this.sessionManager = sessionManager;
        this.registry = registry;
        this.workQueue = workQueue;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Single-shot analysis for clients without a live connection: start, analyze one sample, end.
     */
    @PostMapping("/analyze")
    public Mono<StreamResult> analyze(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @RequestBody AnalyzeRequest request) {
        return Mono.fromCallable(() -> {
            String userId = identityProvider.authenticate(authorization);
            CodeStreamMessage message = new CodeStreamMessage(request.getCodeMetrics(), request.getEditMetadata());
            MessageCodec.validate(message);
            MetricsSample sample = codec.toSample(message, clock.instant());
            return analysisService.analyzeOnce(userId, request.getMetadata(), sample);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/status")
    public Mono<Map<String, Object>> status() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new HashMap<>();
            status.put("live_connections", registry.connectionCount());
            status.put("open_sessions", sessionManager.openSessionCount());
            status.put("work_queue", workQueue.getStats());
            status.put("timestamp", clock.instant());
            return status;
        });
    }
}
