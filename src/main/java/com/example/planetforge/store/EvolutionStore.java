package com.example.planetforge.store;

import com.example.planetforge.model.EvolutionEvent;
import com.example.planetforge.model.Planet;
import com.example.planetforge.model.SessionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for sessions, planets and evolution events.
 * Every method may throw {@link com.example.planetforge.error.StoreUnavailableException}.
 */
public interface EvolutionStore {
    void saveSession(SessionRecord record);
    Optional<Planet> loadPlanet(String planetId);
    Optional<Planet> loadPlanetByOwner(String ownerId);
    void savePlanet(Planet planet);
    void appendEvent(EvolutionEvent event);
    List<EvolutionEvent> recentEvents(String planetId, int limit);
    List<Planet> listPlanets(int limit);
}
