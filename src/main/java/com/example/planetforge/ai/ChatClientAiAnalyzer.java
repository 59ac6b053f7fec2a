package com.example.planetforge.ai;

import com.example.planetforge.error.AnalysisUnavailableException;
import com.example.planetforge.model.MetricsSample;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * {@link AiAnalyzer} backed by a Spring AI {@link ChatClient}, normally pointed at Groq's OpenAI-compatible endpoint.
 * Disabled unless {@code app.ai.enabled=true} and a chat model is configured.
 */
@Component
public class ChatClientAiAnalyzer implements AiAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ChatClientAiAnalyzer.class);

    static final String SYSTEM_PROMPT =
            "You are a code behavior analyst. Analyze coding patterns and return JSON only.";

    private final ChatClient chatClient;
    private final AiResponseParser parser;

    public ChatClientAiAnalyzer(ObjectProvider<ChatClient.Builder> builderProvider,
                                ObjectMapper objectMapper,
                                @Value("${app.ai.enabled:false}") boolean enabled) {
        ChatClient.Builder builder = enabled ? builderProvider.getIfAvailable() : null;
        this.chatClient = builder == null ? null : builder.defaultSystem(SYSTEM_PROMPT).build();
        this.parser = new AiResponseParser(objectMapper);
        if (enabled && chatClient == null) {
            logger.warn("AI analysis enabled but no chat model is configured; heuristic scoring only");
        }
    }

    @Override
    public boolean isAvailable() {
        return chatClient != null;
    }

    @Override
    public AiAssessment analyze(MetricsSample sample) {
        if (chatClient == null) {
            throw new AnalysisUnavailableException("AI analyzer is disabled");
        }
        long start = System.nanoTime();
        String content;
        try {
            content = chatClient.prompt()
                    .user(buildPrompt(sample))
                    .call()
                    .content();
        } catch (RuntimeException e) {
            throw new AnalysisUnavailableException("AI analyzer call failed: " + e.getMessage(), e);
        }
        AiAssessment assessment = parser.parse(content);
        logger.debug("AI analysis completed in {}ms", (System.nanoTime() - start) / 1_000_000);
        return assessment;
    }

    static String buildPrompt(MetricsSample m) {
        return String.format(Locale.ROOT,
                "Analyze this coding activity and provide insights.%n%n"
                        + "Code Metrics:%n"
                        + "- Lines of code: %d%n"
                        + "- Functions: %d%n"
                        + "- Classes: %d%n"
                        + "- Comments: %d%n"
                        + "- Complexity score: %.1f%n"
                        + "- Error handlers: %d%n"
                        + "- Async constructs: %d%n"
                        + "- Language: %s%n"
                        + "- Keystrokes: %d%n%n"
                        + "Return a JSON object with this exact structure:%n"
                        + "{%n"
                        + "  \"coding_style\": \"methodical|modular|complex|pragmatic\",%n"
                        + "  \"personality_traits\": [\"trait1\", \"trait2\"],%n"
                        + "  \"skill_assessment\": {%n"
                        + "    \"algorithm_mastery\": 0.0-100.0,%n"
                        + "    \"web_development\": 0.0-100.0,%n"
                        + "    \"api_design\": 0.0-100.0,%n"
                        + "    \"devops_skills\": 0.0-100.0,%n"
                        + "    \"security_awareness\": 0.0-100.0%n"
                        + "  },%n"
                        + "  \"planet_characteristics\": {%n"
                        + "    \"atmosphere\": \"clear|neon|crystalline|stormy|toxic\",%n"
                        + "    \"terrain\": \"rocky|liquid|crystalline|volcanic|metallic\"%n"
                        + "  },%n"
                        + "  \"insights\": [\"insight1\", \"insight2\"]%n"
                        + "}",
                m.getLines(), m.getFunctions(), m.getClasses(), m.getComments(), m.getComplexity(),
                m.getErrorHandlers(), m.getAsyncMarkers(), m.languageOrUnknown(), m.getKeystrokes());
    }
}
