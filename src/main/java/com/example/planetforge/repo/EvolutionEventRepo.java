package com.example.planetforge.repo;

import com.example.planetforge.model.EvolutionEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EvolutionEventRepo extends MongoRepository<EvolutionEvent, String> {
    List<EvolutionEvent> findByPlanetIdOrderByCreatedAtDesc(String planetId, Pageable pageable);
}
