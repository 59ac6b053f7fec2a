package com.example.planetforge.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    static final List<String> TOOLS = List.of(
            "planet_get", "planet_events", "sessions_active", "stream_status", "capabilities_list");

    @Tool(description = "List available tool names and counts for introspection")
    public Map<String, Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "planet-forge-engine", "version", "0.1.0"),
                "tools", TOOLS,
                "toolCount", TOOLS.size(),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false,
                        "completion", false
                )
        );
    }
}
