package com.example.planetforge.repo;

import com.example.planetforge.model.Planet;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface PlanetRepo extends MongoRepository<Planet, String> {
    Optional<Planet> findByOwnerId(String ownerId);
    List<Planet> findAllByOrderByEvolutionPointsDesc(Pageable pageable);
}
