package com.example.planetforge.store;

import com.example.planetforge.error.StoreUnavailableException;
import com.example.planetforge.model.Planet;
import com.example.planetforge.model.SessionRecord;
import com.example.planetforge.model.Skill;
import com.example.planetforge.repo.EvolutionEventRepo;
import com.example.planetforge.repo.PlanetRepo;
import com.example.planetforge.repo.SessionRecordRepo;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoEvolutionStoreTest {

    @Mock
    private MongoTemplate mongo;

    @Mock
    private SessionRecordRepo sessionRepo;

    @Mock
    private PlanetRepo planetRepo;

    @Mock
    private EvolutionEventRepo eventRepo;

    private MongoEvolutionStore store;

    @BeforeEach
    void setUp() {
        store = new MongoEvolutionStore(mongo, sessionRepo, planetRepo, eventRepo);
    }

    @Test
    void testSaveSession_DataAccessFailureBecomesStoreUnavailable() {
        // Given
        when(sessionRepo.save(any(SessionRecord.class))).thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When & Then
        StoreUnavailableException e = assertThrows(StoreUnavailableException.class,
                () -> store.saveSession(new SessionRecord()));
        assertTrue(e.getMessage().contains("saveSession"));
    }

    @Test
    void testLoadPlanetByOwner_DelegatesToRepo() {
        // Given
        Planet planet = Planet.newborn("alice", Instant.EPOCH);
        when(planetRepo.findByOwnerId("alice")).thenReturn(Optional.of(planet));

        // When
        Optional<Planet> loaded = store.loadPlanetByOwner("alice");

        // Then
        assertSame(planet, loaded.orElseThrow());
    }

    @Test
    void testSavePlanet_UpsertsWithMaxForSkillsAndPoints() {
        // Given
        Planet planet = Planet.newborn("alice", Instant.EPOCH);
        planet.getSkills().put(Skill.API_DESIGN.key(), 12.5);
        planet.setEvolutionPoints(30L);
        planet.getAchievements().add("productivity_burst");

        // When
        store.savePlanet(planet);

        // Then
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(mongo).upsert(query.capture(), update.capture(), eq(Planet.class));

        assertEquals(planet.getId(), query.getValue().getQueryObject().get("_id"));
        Document max = (Document) update.getValue().getUpdateObject().get("$max");
        assertEquals(30L, max.get("evolutionPoints"));
        assertEquals(12.5, max.get("skills." + Skill.API_DESIGN.key()));
        assertEquals(0.0, max.get("skills." + Skill.WEB_DEVELOPMENT.key()));
        assertNotNull(update.getValue().getUpdateObject().get("$addToSet"));
    }

    @Test
    void testListPlanets_FailureBecomesStoreUnavailable() {
        // Given
        when(planetRepo.findAllByOrderByEvolutionPointsDesc(any())).thenThrow(new DataAccessResourceFailureException("timeout"));

        // When & Then
        assertThrows(StoreUnavailableException.class, () -> store.listPlanets(10));
    }

    @Test
    void testSavePlanet_OnlyReplacesOlderRevisions() {
        // Given
        Planet planet = Planet.newborn("alice", Instant.EPOCH);
        planet.setRevision(4L);

        // When
        store.savePlanet(planet);

        // Then
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(mongo).upsert(query.capture(), update.capture(), eq(Planet.class));

        List<?> or = (List<?>) query.getValue().getQueryObject().get("$or");
        Document newer = (Document) ((Document) or.get(0)).get("revision");
        assertEquals(4L, newer.get("$lt"));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(4L, set.get("revision"));
    }

    @Test
    void testSavePlanet_StaleRevisionIsSkipped() {
        // Given
        Planet planet = Planet.newborn("alice", Instant.EPOCH);
        planet.setRevision(2L);
        when(mongo.upsert(any(Query.class), any(UpdateDefinition.class), eq(Planet.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key error"));

        // When & Then
        assertDoesNotThrow(() -> store.savePlanet(planet));
    }
}
