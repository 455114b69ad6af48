package com.example.videoenhance.ai.providers;

import com.example.videoenhance.ai.core.MalformedResponseException;
import com.example.videoenhance.ai.util.AIResponseFixer;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.CritiqueIssue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the critique model's free-form answer into a {@link Critique}.
 *
 * <p>Accepted shapes, in any mix:
 * <ul>
 *   <li>{@code {"score": 7.5, "issues": [...]}}</li>
 *   <li>{@code {"professionalScore": "7.5", "remainingImprovements": [...], "noFurtherEditsNeeded": false}}</li>
 * </ul>
 * Issues may be plain strings (global) or objects carrying {@code description}/{@code editInstruction},
 * {@code region} and one of {@code surgical}, {@code imagenSuitable} or {@code type: "local"}.
 * Scores on a 0-100 scale are brought down to 0-10.
 */
@Component
public class CritiqueResponseAdapter {

    private static final Logger log = LoggerFactory.getLogger(CritiqueResponseAdapter.class);

    private static final Set<String> SURGICAL_TYPES = Set.of("surgical", "local", "localized");

    private final ObjectMapper objectMapper;

    public CritiqueResponseAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param provider name used in the exception when the text cannot be read
     * @throws MalformedResponseException if no JSON object or no usable score can be recovered
     */
    public Critique adapt(String provider, String rawText) {
        JsonNode root = AIResponseFixer.parseObject(rawText, objectMapper);
        if (root == null) {
            throw new MalformedResponseException(provider, "critique is not a JSON object");
        }

        Double score = readScore(root.has("score") ? root.get("score") : root.get("professionalScore"));
        if (score == null) {
            throw new MalformedResponseException(provider, "critique has no numeric score");
        }

        List<CritiqueIssue> issues = new ArrayList<>();
        if (!root.path("noFurtherEditsNeeded").asBoolean(false)) {
            JsonNode issueArray = root.has("issues") ? root.get("issues") : root.get("remainingImprovements");
            if (issueArray != null && issueArray.isArray()) {
                for (JsonNode item : issueArray) {
                    CritiqueIssue issue = readIssue(item);
                    if (issue != null) {
                        issues.add(issue);
                    }
                }
            }
        }

        String assessment = textOrNull(root.has("assessment") ? root.get("assessment") : root.get("overallAssessment"));
        Critique critique = new Critique(score, issues, assessment);
        log.debug("Adapted critique from {}: {}", provider, critique);
        return critique;
    }

    private Double readScore(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        if (value > Critique.MAX_SCORE && value <= 100) {
            value = value / 10.0;
        }
        return value;
    }

    /**
     * Null for items that carry no text, that are marked unsafe to propagate
     * across the group, or whose impact is "low".
     */
    private CritiqueIssue readIssue(JsonNode item) {
        if (item.isTextual()) {
            String text = item.asText().trim();
            return text.isEmpty() ? null : CritiqueIssue.global(text);
        }
        if (!item.isObject()) {
            return null;
        }
        if (item.has("safeForPropagation") && !item.get("safeForPropagation").asBoolean(true)) {
            return null;
        }
        if ("low".equalsIgnoreCase(item.path("impact").asText(""))) {
            return null;
        }

        String description = textOrNull(item.get("editInstruction"));
        if (description == null) {
            description = textOrNull(item.get("description"));
        }
        if (description == null) {
            return null;
        }

        String region = textOrNull(item.get("region"));
        boolean surgical = item.path("surgical").asBoolean(false)
                || item.path("imagenSuitable").asBoolean(false)
                || SURGICAL_TYPES.contains(item.path("type").asText("").toLowerCase(Locale.ROOT));

        return new CritiqueIssue(description, region != null ? region : CritiqueIssue.GLOBAL_REGION, surgical);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
