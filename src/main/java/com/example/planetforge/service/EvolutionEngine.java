package com.example.planetforge.service;

import com.example.planetforge.error.StoreUnavailableException;
import com.example.planetforge.model.Achievement;
import com.example.planetforge.model.BehaviorSample;
import com.example.planetforge.model.BehavioralAnalysis;
import com.example.planetforge.model.CodingGenome;
import com.example.planetforge.model.EvolutionEvent;
import com.example.planetforge.model.EvolutionResult;
import com.example.planetforge.model.EvolutionStage;
import com.example.planetforge.model.MetricsSample;
import com.example.planetforge.model.PersonalityTrait;
import com.example.planetforge.model.Planet;
import com.example.planetforge.model.PlanetSnapshot;
import com.example.planetforge.model.PlanetTraitUpdate;
import com.example.planetforge.model.SessionSnapshot;
import com.example.planetforge.model.SessionSummary;
import com.example.planetforge.model.Skill;
import com.example.planetforge.model.SkillDeltaSet;
import com.example.planetforge.store.EvolutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Sole writer of planet skills and stages.
 *
 * Writes for one owner are serialized by a per-owner lock; different owners never contend. The engine keeps
 * the planets it has touched in memory and persists every change through the {@link BackgroundWorkQueue},
 * so a slow or unavailable store never blocks a delta application. A planet whose latest revision has been
 * stored and that has been idle for {@code app.evolution.working-idle} is dropped from memory and reloaded
 * from the store on next use.
 */
@Service
public class EvolutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(EvolutionEngine.class);

    static final double MAX_SKILL = 100.0;

    private final EvolutionStore store;
    private final PlanetCache cache;
    private final BackgroundWorkQueue workQueue;
    private final EvolutionStageTable stageTable;
    private final Clock clock;

    private final Map<String, Planet> working = new ConcurrentHashMap<>();
    private final Set<String> unhydrated = ConcurrentHashMap.newKeySet();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    // highest planet revision known to be in the store, per owner held in memory
    private final Map<String, Long> storedRevisions = new ConcurrentHashMap<>();

    @Value("${app.evolution.stage-bonus:50}")
    private int stageBonus = 50;

    @Value("${app.evolution.trait-smoothing:0.3}")
    private double traitSmoothing = 0.3;

    @Value("${app.evolution.working-idle:10m}")
    private Duration workingIdle = Duration.ofMinutes(10);

    public EvolutionEngine(EvolutionStore store, PlanetCache cache, BackgroundWorkQueue workQueue,
                           EvolutionStageTable stageTable, Clock clock) {
        this.store = store;
        this.cache = cache;
        this.workQueue = workQueue;
        this.stageTable = stageTable;
        this.clock = clock;
    }

    public EvolutionResult applyDeltas(String ownerId, SkillDeltaSet deltas) {
        return apply(ownerId, deltas, null, null, null);
    }

    /**
     * Applies the scorer's deltas and trait updates, and evaluates achievements against the sample.
     */
    public EvolutionResult applySample(String ownerId, MetricsSample sample, BehavioralAnalysis analysis) {
        return apply(ownerId, analysis.getSkillDeltas(), sample, analysis.getPlanetUpdates(), analysis.getGenome());
    }

    private EvolutionResult apply(String ownerId, SkillDeltaSet deltas, MetricsSample sample,
                                  PlanetTraitUpdate traits, CodingGenome genome) {
        ReentrantLock lock = lockOwner(ownerId);
        try {
            Planet planet = workingPlanet(ownerId);
            PlanetSnapshot before = planet.snapshot();
            Instant now = clock.instant();

            Map<String, Double> skills = new LinkedHashMap<>();
            for (Skill skill : Skill.values()) {
                double old = planet.skill(skill);
                skills.put(skill.key(), Math.min(MAX_SKILL, Math.max(old, old + deltas.get(skill))));
            }
            planet.setSkills(skills);

            EvolutionStage previous = planet.getStage();
            EvolutionStage computed = stageTable.stageFor(planet.meanSkill());
            EvolutionStage next = computed.isAfter(previous) ? computed : previous;
            boolean stageChanged = next != previous;
            planet.setStage(next);

            double pointsEarned = deltas.total() + (stageChanged ? stageBonus : 0);
            planet.addPoints(pointsEarned);

            if (traits != null) {
                if (traits.getTerrain() != null) planet.setTerrain(traits.getTerrain());
                if (traits.getAtmosphere() != null) planet.setAtmosphere(traits.getAtmosphere());
            }
            if (genome != null) {
                planet.setGenome(genome);
            }
            planet.touch(now);
            planet.setLastActivityAt(now);

            List<Achievement> unlocked = new ArrayList<>();
            for (AchievementRule rule : AchievementRule.values()) {
                if (rule.matches(sample, pointsEarned, stageChanged) && !planet.hasAchievement(rule.id())) {
                    planet.getAchievements().add(rule.id());
                    unlocked.add(rule.toAchievement());
                }
            }

            PlanetSnapshot after = planet.snapshot();
            EvolutionEvent event = EvolutionEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .planetId(planet.getId())
                    .ownerId(ownerId)
                    .eventType(stageChanged ? EvolutionEvent.TYPE_STAGE_EVOLUTION : EvolutionEvent.TYPE_SKILL_GROWTH)
                    .description(describe(before, after, pointsEarned, stageChanged))
                    .pointsEarned(pointsEarned)
                    .deltas(deltas.asMap())
                    .previousState(before)
                    .newState(after)
                    .createdAt(now)
                    .build();

            persist(planet.copy(), event);

            if (stageChanged) {
                logger.info("Planet {} of {} evolved {} -> {} (mean skill {})", planet.getId(), ownerId,
                        previous.key(), next.key(), String.format(Locale.ROOT, "%.1f", after.getMeanSkill()));
            } else {
                logger.debug("Planet {} gained {} points", planet.getId(), pointsEarned);
            }

            return EvolutionResult.builder()
                    .planetId(planet.getId())
                    .ownerId(ownerId)
                    .before(before)
                    .after(after)
                    .stageChanged(stageChanged)
                    .pointsEarned(pointsEarned)
                    .deltas(deltas)
                    .achievements(unlocked)
                    .eventId(event.getId())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @EventListener
    public void onSessionClosed(SessionClosedEvent event) {
        SessionSnapshot snapshot = event.getSnapshot();
        workQueue.submit("absorb session " + event.getSessionId(), () -> absorbSession(snapshot));
    }

    /**
     * Folds a closed session into the planet's activity totals and personality traits.
     * Skills and stage are left alone.
     */
    public void absorbSession(SessionSnapshot snapshot) {
        SessionSummary summary = snapshot.getSummary();
        String ownerId = summary.getUserId();
        ReentrantLock lock = lockOwner(ownerId);
        try {
            Planet planet = workingPlanet(ownerId);
            planet.setTotalCodingSeconds(planet.getTotalCodingSeconds() + summary.getDurationSeconds());
            planet.setSessionCount(planet.getSessionCount() + 1);

            Map<PersonalityTrait, Double> observed = observeTraits(snapshot.getSamples());
            Map<String, Double> traits = new LinkedHashMap<>(planet.getPersonalityTraits());
            observed.forEach((trait, value) -> {
                Double old = traits.get(trait.key());
                traits.put(trait.key(), old == null ? value : old + traitSmoothing * (value - old));
            });
            planet.setPersonalityTraits(traits);
            planet.touch(clock.instant());

            Planet copy = planet.copy();
            workQueue.submit("save planet " + copy.getId(), () -> savePlanet(copy));
            cache.put(copy);
            logger.debug("Absorbed session {} into planet {}", summary.getSessionId(), planet.getId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Display read: cache, then store, then the in-memory working copy. May lag the write path.
     */
    public Optional<Planet> planetView(String ownerId) {
        Optional<Planet> cached = cache.get(ownerId);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            Optional<Planet> stored = store.loadPlanetByOwner(ownerId);
            stored.ifPresent(cache::put);
            if (stored.isPresent()) {
                return stored;
            }
        } catch (StoreUnavailableException e) {
            logger.warn("Planet store unavailable for display read of {}: {}", ownerId, e.getMessage());
        }
        return Optional.ofNullable(working.get(ownerId)).map(this::lockedCopy);
    }

    public List<EvolutionEvent> recentEvents(String ownerId, int limit) {
        return store.recentEvents(Planet.idFor(ownerId), limit);
    }

    /**
     * Best-effort listing ordered by evolution points; falls back to planets held in memory.
     */
    public List<Planet> listPlanets(int limit) {
        try {
            return store.listPlanets(limit);
        } catch (StoreUnavailableException e) {
            logger.warn("Planet store unavailable for listing, serving in-memory planets: {}", e.getMessage());
            return working.values().stream()
                    .map(this::lockedCopy)
                    .sorted(Comparator.comparingLong(Planet::getEvolutionPoints).reversed())
                    .limit(Math.max(limit, 1))
                    .collect(Collectors.toList());
        }
    }

    // caller holds the owner's lock
    private Planet workingPlanet(String ownerId) {
        Planet planet = working.get(ownerId);
        if (planet != null && !unhydrated.contains(ownerId)) {
            return planet;
        }
        try {
            Optional<Planet> stored = store.loadPlanetByOwner(ownerId);
            unhydrated.remove(ownerId);
            if (planet != null) {
                stored.ifPresent(s -> mergeDurable(planet, s));
                return planet;
            }
            Planet loaded = stored.map(this::normalize).orElseGet(() -> {
                logger.info("Creating planet for {}", ownerId);
                return Planet.newborn(ownerId, clock.instant());
            });
            working.put(ownerId, loaded);
            storedRevisions.put(ownerId, stored.isPresent() ? loaded.getRevision() : -1L);
            return loaded;
        } catch (StoreUnavailableException e) {
            if (planet != null) {
                return planet;
            }
            logger.warn("Planet store unavailable for {}, continuing with in-memory state: {}", ownerId, e.getMessage());
            Planet fresh = Planet.newborn(ownerId, clock.instant());
            working.put(ownerId, fresh);
            storedRevisions.put(ownerId, -1L);
            unhydrated.add(ownerId);
            return fresh;
        }
    }

    private Planet normalize(Planet stored) {
        Map<String, Double> skills = new LinkedHashMap<>();
        for (Skill skill : Skill.values()) {
            skills.put(skill.key(), Math.min(MAX_SKILL, Math.max(0.0, stored.skill(skill))));
        }
        stored.setSkills(skills);
        EvolutionStage computed = stageTable.stageFor(stored.meanSkill());
        if (stored.getStage() == null || computed.isAfter(stored.getStage())) {
            stored.setStage(computed);
        }
        if (stored.getEvolutionScore() < stored.getEvolutionPoints()) {
            stored.setEvolutionScore(stored.getEvolutionPoints());
        }
        if (stored.getPersonalityTraits() == null) stored.setPersonalityTraits(new LinkedHashMap<>());
        if (stored.getAchievements() == null) stored.setAchievements(new LinkedHashSet<>());
        return stored;
    }

    /** Raises in-memory state to anything higher found in storage once the store is reachable again. */
    private void mergeDurable(Planet memory, Planet stored) {
        Planet durable = normalize(stored);
        Map<String, Double> skills = new LinkedHashMap<>();
        for (Skill skill : Skill.values()) {
            skills.put(skill.key(), Math.max(memory.skill(skill), durable.skill(skill)));
        }
        memory.setSkills(skills);
        if (durable.getStage().isAfter(memory.getStage())) {
            memory.setStage(durable.getStage());
        }
        if (durable.getEvolutionScore() > memory.getEvolutionScore()) {
            memory.setEvolutionScore(durable.getEvolutionScore());
        }
        memory.setEvolutionPoints(Math.max(memory.getEvolutionPoints(), durable.getEvolutionPoints()));
        if (memory.getGenome() == null) {
            memory.setGenome(durable.getGenome());
        }
        // later writes must supersede whatever the store already holds
        memory.setRevision(Math.max(memory.getRevision(), durable.getRevision()));
        memory.getAchievements().addAll(durable.getAchievements());
        if (memory.getPersonalityTraits().isEmpty()) {
            memory.setPersonalityTraits(new LinkedHashMap<>(durable.getPersonalityTraits()));
        }
        memory.setTotalCodingSeconds(Math.max(memory.getTotalCodingSeconds(), durable.getTotalCodingSeconds()));
        memory.setSessionCount(Math.max(memory.getSessionCount(), durable.getSessionCount()));
        memory.setCreatedAt(durable.getCreatedAt() == null ? memory.getCreatedAt() : durable.getCreatedAt());
        memory.setName(durable.getName() == null ? memory.getName() : durable.getName());
        logger.info("Merged stored state into in-memory planet of {}", memory.getOwnerId());
    }

    private void persist(Planet copy, EvolutionEvent event) {
        workQueue.submit("save planet " + copy.getId(), () -> savePlanet(copy));
        workQueue.submit("append event " + event.getId(), () -> store.appendEvent(event));
        workQueue.submit("cache planet " + copy.getId(), () -> cache.put(copy), 1);
    }

    private void savePlanet(Planet copy) {
        store.savePlanet(copy);
        storedRevisions.computeIfPresent(copy.getOwnerId(), (k, v) -> Math.max(v, copy.getRevision()));
    }

    /**
     * Drops planets from memory once their latest revision is stored and they have been idle for
     * {@code app.evolution.working-idle}. Planets not yet reconciled with the store are kept.
     *
     * @return number of planets evicted
     */
    @Scheduled(fixedDelayString = "${app.evolution.eviction-interval-ms:60000}",
               initialDelayString = "${app.evolution.eviction-interval-ms:60000}")
    public int evictIdlePlanets() {
        Instant cutoff = clock.instant().minus(workingIdle);
        int evicted = 0;
        for (String ownerId : working.keySet()) {
            ReentrantLock lock = locks.get(ownerId);
            if (lock == null || !lock.tryLock()) {
                continue;
            }
            try {
                Planet planet = working.get(ownerId);
                if (planet == null || unhydrated.contains(ownerId)) {
                    continue;
                }
                Instant touched = planet.getUpdatedAt();
                if (touched != null && !touched.isBefore(cutoff)) {
                    continue;
                }
                Long stored = storedRevisions.get(ownerId);
                if (stored == null || stored < planet.getRevision()) {
                    continue;
                }
                working.remove(ownerId);
                storedRevisions.remove(ownerId);
                locks.remove(ownerId, lock);
                evicted++;
            } finally {
                lock.unlock();
            }
        }
        if (evicted > 0) {
            logger.info("Evicted {} idle planet(s) from memory, {} remain", evicted, working.size());
        }
        return evicted;
    }

    int workingCount() {
        return working.size();
    }

    private Planet lockedCopy(Planet planet) {
        ReentrantLock lock = lockOwner(planet.getOwnerId());
        try {
            return planet.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the owner's lock, held. Retries when eviction retired the lock between lookup and acquisition.
     */
    private ReentrantLock lockOwner(String ownerId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(ownerId, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(ownerId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    static Map<PersonalityTrait, Double> observeTraits(List<BehaviorSample> samples) {
        Map<PersonalityTrait, Double> traits = new EnumMap<>(PersonalityTrait.class);
        if (samples.isEmpty()) {
            return traits;
        }
        double commentRatio = 0, functionDensity = 0, complexity = 0, withErrors = 0, withAsync = 0;
        for (BehaviorSample s : samples) {
            commentRatio += s.getCommentRatio();
            functionDensity += s.getFunctionDensity();
            complexity += s.getComplexity();
            if (s.getErrorHandlers() > 0) withErrors++;
            if (s.getAsyncMarkers() > 0) withAsync++;
        }
        int n = samples.size();
        traits.put(PersonalityTrait.DOCUMENTATION_INCLINATION, clamp01(commentRatio / n * 4));
        traits.put(PersonalityTrait.MODULARITY, clamp01(functionDensity / n * 10));
        traits.put(PersonalityTrait.COMPLEXITY_APPETITE, clamp01(complexity / n / 20));
        traits.put(PersonalityTrait.RESILIENCE, withErrors / n);
        traits.put(PersonalityTrait.CONCURRENCY_AFFINITY, withAsync / n);
        return traits;
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static String describe(PlanetSnapshot before, PlanetSnapshot after, double points, boolean stageChanged) {
        if (stageChanged) {
            return String.format(Locale.ROOT, "Evolved from %s to %s", before.getStage().key(), after.getStage().key());
        }
        return String.format(Locale.ROOT, "Gained %.2f evolution points", points);
    }
}
