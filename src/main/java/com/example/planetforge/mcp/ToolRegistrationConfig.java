package com.example.planetforge.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final EvolutionTools evolutionTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(EvolutionTools evolutionTools, CapabilitiesTools capTools) {
        this.evolutionTools = evolutionTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(evolutionTools, capTools)
                .build();
    }
}
