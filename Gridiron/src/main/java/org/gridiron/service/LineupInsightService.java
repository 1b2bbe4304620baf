package org.gridiron.service;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.mistralai.MistralAiChatModel;
import org.gridiron.config.GridironConfig;
import org.gridiron.lineup.LineupResult;
import org.gridiron.lineup.ScoredPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Asks a chat model for a short, human-readable take on an optimized lineup. Purely additive:
 * the lineup itself is never changed and any model failure just means no insight.
 */
public class LineupInsightService {

    private static final Logger log = LoggerFactory.getLogger(LineupInsightService.class);

    static final String SYSTEM_INSTRUCTIONS =
        "You are a fantasy football analyst. Below is a lineup chosen by a scoring engine. "
        + "In at most 5 short bullet points, explain the key start/sit calls, flag risky starters "
        + "and mention any bench player worth monitoring. Do not invent statistics that are not listed.\n";

    private final ChatModel model;

    public LineupInsightService(ChatModel model) {
        this.model = model;
    }

    /** Mistral model when {@code MISTRAL_API_KEY} is set, otherwise a service that never answers. */
    public static LineupInsightService fromConfig(GridironConfig config) {
        return new LineupInsightService(chatModel(config));
    }

    /** @return the configured Mistral model, or null without an API key */
    public static ChatModel chatModel(GridironConfig config) {
        String apiKey = config.get(GridironConfig.MISTRAL_API_KEY);
        if (apiKey == null) {
            return null;
        }
        return MistralAiChatModel.builder()
                .apiKey(apiKey)
                .modelName("mistral-large-latest")
                .temperature(0.3)
                .timeout(Duration.ofSeconds(60))
                .build();
    }

    public boolean isAvailable() {
        return model != null;
    }

    public Optional<String> summarize(LineupResult result) {
        if (model == null) {
            log.warn("Insight requested but MISTRAL_API_KEY is not configured");
            return Optional.empty();
        }
        try {
            String answer = model.chat(buildPrompt(result));
            return answer == null || answer.isBlank() ? Optional.empty() : Optional.of(answer.trim());
        } catch (RuntimeException e) {
            log.warn("Insight generation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static String buildPrompt(LineupResult result) {
        StringBuilder sb = new StringBuilder(SYSTEM_INSTRUCTIONS);
        sb.append("\nStrategy: ").append(result.strategyUsed() == null ? "n/a" : result.strategyUsed().key()).append("\n");
        sb.append("\n[STARTERS]\n");
        for (Map.Entry<String, ScoredPlayer> e : result.starters().entrySet()) {
            sb.append("- ").append(e.getKey()).append(": ").append(describe(e.getValue())).append("\n");
        }
        sb.append("\n[BENCH]\n");
        result.bench().stream().limit(5).forEach(sp -> sb.append("- ").append(describe(sp)).append("\n"));
        if (!result.recommendations().isEmpty()) {
            sb.append("\n[ENGINE NOTES]\n");
            result.recommendations().forEach(r -> sb.append("- ").append(r).append("\n"));
        }
        return sb.toString();
    }

    private static String describe(ScoredPlayer sp) {
        StringBuilder sb = new StringBuilder(sp.name()).append(" (").append(sp.position());
        if (sp.player().getTeam() != null) sb.append(", ").append(sp.player().getTeam());
        sb.append(") tier ").append(sp.tier());
        if (sp.isScored()) sb.append(String.format(Locale.ROOT, ", score %.1f", sp.compositeScore()));
        if (sp.player().getMatchupDescription() != null) sb.append(", ").append(sp.player().getMatchupDescription());
        if (sp.player().getInjuryStatus() != null) sb.append(", status ").append(sp.player().getInjuryStatus());
        return sb.toString();
    }
}
