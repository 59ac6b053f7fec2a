package com.example.planetforge.store;

import com.example.planetforge.error.StoreUnavailableException;
import com.example.planetforge.model.EvolutionEvent;
import com.example.planetforge.model.Planet;
import com.example.planetforge.model.SessionRecord;
import com.example.planetforge.model.Skill;
import com.example.planetforge.repo.EvolutionEventRepo;
import com.example.planetforge.repo.PlanetRepo;
import com.example.planetforge.repo.SessionRecordRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Component
public class MongoEvolutionStore implements EvolutionStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEvolutionStore.class);

    private final MongoTemplate mongo;
    private final SessionRecordRepo sessionRepo;
    private final PlanetRepo planetRepo;
    private final EvolutionEventRepo eventRepo;

    @Autowired
    public MongoEvolutionStore(MongoTemplate mongo, SessionRecordRepo sessionRepo,
                               PlanetRepo planetRepo, EvolutionEventRepo eventRepo) {
        this.mongo = mongo;
        this.sessionRepo = sessionRepo;
        this.planetRepo = planetRepo;
        this.eventRepo = eventRepo;
    }

    @Override
    public void saveSession(SessionRecord record) {
        call("saveSession", () -> sessionRepo.save(record));
    }

    @Override
    public Optional<Planet> loadPlanet(String planetId) {
        return call("loadPlanet", () -> planetRepo.findById(planetId));
    }

    @Override
    public Optional<Planet> loadPlanetByOwner(String ownerId) {
        return call("loadPlanetByOwner", () -> planetRepo.findByOwnerId(ownerId));
    }

    /**
     * Upserts the planet unless the stored document already carries the same or a newer revision, so a
     * retried write that lands after a newer one is discarded. Skills and evolution points are also written
     * with {@code $max} and can never be lowered.
     */
    @Override
    public void savePlanet(Planet planet) {
        Query q = new Query(Criteria.where("_id").is(planet.getId()).orOperator(
                Criteria.where("revision").lt(planet.getRevision()),
                Criteria.where("revision").exists(false)));
        Update u = new Update()
                .setOnInsert("createdAt", planet.getCreatedAt())
                .set("ownerId", planet.getOwnerId())
                .set("name", planet.getName())
                .set("terrain", planet.getTerrain())
                .set("atmosphere", planet.getAtmosphere())
                .set("stage", planet.getStage())
                .set("personalityTraits", planet.getPersonalityTraits())
                .set("totalCodingSeconds", planet.getTotalCodingSeconds())
                .set("sessionCount", planet.getSessionCount())
                .set("genome", planet.getGenome())
                .set("revision", planet.getRevision())
                .set("updatedAt", planet.getUpdatedAt())
                .set("lastActivityAt", planet.getLastActivityAt())
                .max("evolutionScore", planet.getEvolutionScore())
                .max("evolutionPoints", planet.getEvolutionPoints());
        for (Skill skill : Skill.values()) {
            u.max("skills." + skill.key(), planet.skill(skill));
        }
        if (planet.getAchievements() != null && !planet.getAchievements().isEmpty()) {
            u.addToSet("achievements").each(planet.getAchievements().toArray());
        }
        call("savePlanet", () -> {
            try {
                return mongo.upsert(q, u, Planet.class);
            } catch (DuplicateKeyException e) {
                // a newer stored revision makes the query miss, and the upsert then collides on _id
                logger.debug("Skipped stale write of planet {} at revision {}", planet.getId(), planet.getRevision());
                return null;
            }
        });
    }

    @Override
    public void appendEvent(EvolutionEvent event) {
        call("appendEvent", () -> mongo.insert(event));
    }

    @Override
    public List<EvolutionEvent> recentEvents(String planetId, int limit) {
        return call("recentEvents",
                () -> eventRepo.findByPlanetIdOrderByCreatedAtDesc(planetId, PageRequest.of(0, Math.max(limit, 1))));
    }

    @Override
    public List<Planet> listPlanets(int limit) {
        return call("listPlanets",
                () -> planetRepo.findAllByOrderByEvolutionPointsDesc(PageRequest.of(0, Math.max(limit, 1))));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("MongoDB " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
