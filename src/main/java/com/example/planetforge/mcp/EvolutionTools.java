package com.example.planetforge.mcp;

import com.example.planetforge.model.EvolutionEvent;
import com.example.planetforge.model.Planet;
import com.example.planetforge.model.SessionView;
import com.example.planetforge.service.BackgroundWorkQueue;
import com.example.planetforge.service.EvolutionEngine;
import com.example.planetforge.service.SessionManager;
import com.example.planetforge.stream.ConnectionRegistry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class EvolutionTools {

    private final EvolutionEngine evolutionEngine;
    private final SessionManager sessionManager;
    private final ConnectionRegistry registry;
    private final BackgroundWorkQueue workQueue;

    public EvolutionTools(EvolutionEngine evolutionEngine, SessionManager sessionManager,
                          ConnectionRegistry registry, BackgroundWorkQueue workQueue) {
        this.evolutionEngine = evolutionEngine;
        this.sessionManager = sessionManager;
        this.registry = registry;
        this.workQueue = workQueue;
    }

    @Tool(description = "Get the planet of a user: skills, stage, evolution points, traits and achievements")
    public Map<String, Object> planet_get(String ownerId) {
        Optional<Planet> planet = evolutionEngine.planetView(ownerId);
        Map<String, Object> result = new HashMap<>();
        result.put("ownerId", ownerId);
        result.put("found", planet.isPresent());
        planet.ifPresent(p -> result.put("planet", p));
        return result;
    }

    @Tool(description = "List the most recent evolution events of a user's planet, newest first")
    public List<EvolutionEvent> planet_events(String ownerId, Integer limit) {
        int n = (limit == null || limit <= 0) ? 20 : Math.min(limit, 100);
        return evolutionEngine.recentEvents(ownerId, n);
    }

    @Tool(description = "List open coding sessions")
    public List<SessionView> sessions_active() {
        return sessionManager.activeSessions();
    }

    @Tool(description = "Live connection count, open session count and background queue statistics")
    public Map<String, Object> stream_status() {
        Map<String, Object> status = new HashMap<>();
        status.put("liveConnections", registry.connectionCount());
        status.put("openSessions", sessionManager.openSessionCount());
        status.put("workQueue", workQueue.getStats());
        status.put("timestamp", Instant.now());
        return status;
    }
}
