package com.example.planetforge.service;

import com.example.planetforge.kv.KvClient;
import com.example.planetforge.model.Planet;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-side cache of planets for display. Entries expire after {@code app.cache.planet-ttl};
 * readers tolerate that much staleness. Cache failures are logged and treated as misses.
 */
@Component
public class PlanetCache {

    private static final Logger logger = LoggerFactory.getLogger(PlanetCache.class);

    static final String KEY_PREFIX = "planet:";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;

    @Value("${app.cache.planet-ttl:30s}")
    private Duration ttl = Duration.ofSeconds(30);

    public PlanetCache(KvClient kvClient, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
    }

    public Optional<Planet> get(String ownerId) {
        try {
            Optional<String> json = kvClient.get(KEY_PREFIX + ownerId);
            if (json.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json.get(), Planet.class));
        } catch (Exception e) {
            logger.warn("Planet cache read failed for {}: {}", ownerId, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(Planet planet) {
        try {
            kvClient.set(KEY_PREFIX + planet.getOwnerId(), objectMapper.writeValueAsString(planet), ttl);
        } catch (Exception e) {
            logger.warn("Planet cache write failed for {}: {}", planet.getOwnerId(), e.getMessage());
        }
    }

    public void evict(String ownerId) {
        try {
            kvClient.del(KEY_PREFIX + ownerId);
        } catch (Exception e) {
            logger.warn("Planet cache evict failed for {}: {}", ownerId, e.getMessage());
        }
    }
}
