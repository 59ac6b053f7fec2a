package com.example.planetforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PlanetForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanetForgeApplication.class, args);
    }
}
