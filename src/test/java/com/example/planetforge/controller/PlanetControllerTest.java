package com.example.planetforge.controller;

import com.example.planetforge.auth.IdentityProvider;
import com.example.planetforge.error.UnauthenticatedException;
import com.example.planetforge.model.Planet;
import com.example.planetforge.service.EvolutionEngine;
import com.example.planetforge.store.EvolutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlanetControllerTest {

    @Mock
    private IdentityProvider identityProvider;

    @Mock
    private EvolutionEngine evolutionEngine;

    @Mock
    private EvolutionStore store;

    private PlanetController controller;

    @BeforeEach
    void setUp() {
        controller = new PlanetController(identityProvider, evolutionEngine, store);
    }

    @Test
    void testMyPlanet_ReturnsAuthenticatedUsersPlanet() {
        // Given
        Planet planet = Planet.newborn("alice", Instant.EPOCH);
        when(identityProvider.authenticate("Bearer t")).thenReturn("alice");
        when(evolutionEngine.planetView("alice")).thenReturn(Optional.of(planet));

        // When & Then
        StepVerifier.create(controller.myPlanet("Bearer t"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertSame(planet, response.getBody());
                })
                .verifyComplete();
    }

    @Test
    void testMyPlanet_NotFoundWhenNoPlanetYet() {
        // Given
        when(identityProvider.authenticate("Bearer t")).thenReturn("bob");
        when(evolutionEngine.planetView("bob")).thenReturn(Optional.empty());

        // When & Then
        StepVerifier.create(controller.myPlanet("Bearer t"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void testMyPlanet_RejectsMissingToken() {
        // Given
        when(identityProvider.authenticate(null)).thenThrow(new UnauthenticatedException("Missing bearer token"));

        // When & Then
        StepVerifier.create(controller.myPlanet(null))
                .expectError(UnauthenticatedException.class)
                .verify();
        verifyNoInteractions(evolutionEngine);
    }

    @Test
    void testList_ClampsLimit() {
        // Given
        when(evolutionEngine.listPlanets(PlanetController.MAX_LIMIT)).thenReturn(List.of());

        // When & Then
        StepVerifier.create(controller.list(5000))
                .expectNext(List.of())
                .verifyComplete();
        verify(evolutionEngine).listPlanets(100);
    }

    @Test
    void testMyEvents_ClampsLowLimit() {
        // Given
        when(identityProvider.authenticate("Bearer t")).thenReturn("alice");
        when(evolutionEngine.recentEvents("alice", 1)).thenReturn(List.of());

        // When & Then
        StepVerifier.create(controller.myEvents("Bearer t", 0))
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void testPlanet_LooksUpById() {
        // Given
        when(store.loadPlanet("missing")).thenReturn(Optional.empty());

        // When & Then
        StepVerifier.create(controller.planet("missing"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }
}
