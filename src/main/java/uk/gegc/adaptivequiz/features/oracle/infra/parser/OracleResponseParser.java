package uk.gegc.adaptivequiz.features.oracle.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.oracle.domain.model.GeneratedQuestion;
import uk.gegc.adaptivequiz.features.oracle.domain.model.MathConcept;
import uk.gegc.adaptivequiz.features.oracle.domain.model.PerformanceInsights;
import uk.gegc.adaptivequiz.shared.exception.AIResponseParseException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw model output into oracle domain objects. The model is asked for
 * JSON only, but replies are still tolerated when wrapped in markdown fences
 * or surrounded by prose.
 */
@Component
@Slf4j
public class OracleResponseParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public List<MathConcept> parseConcepts(String aiResponse) {
        JsonNode root = readJson(aiResponse);
        JsonNode items = root.isArray() ? root : root.get("concepts");
        if (items == null || !items.isArray() || items.isEmpty()) {
            throw new AIResponseParseException("Concept plan must be a non-empty JSON array");
        }

        List<MathConcept> concepts = new ArrayList<>();
        for (JsonNode item : items) {
            String name = getRequiredStringField(item, "concept_name");
            String description = getRequiredStringField(item, "description");
            int baseDifficulty = clampDifficulty(getRequiredIntField(item, "base_difficulty"));
            concepts.add(new MathConcept(name, description, baseDifficulty));
        }
        return concepts;
    }

    public GeneratedQuestion parseQuestion(String aiResponse) {
        JsonNode root = requireObject(readJson(aiResponse));
        String question = getRequiredStringField(root, "question");
        String answer = getRequiredScalarField(root, "answer");
        String explanation = getRequiredStringField(root, "explanation");
        String skill = getRequiredStringField(root, "skill");
        int difficulty = clampDifficulty(getRequiredIntField(root, "difficulty"));
        return new GeneratedQuestion(question, answer, explanation, skill, difficulty);
    }

    /**
     * Parsed judgment before explanation fallbacks are applied.
     */
    public RawJudgment parseJudgment(String aiResponse) {
        JsonNode root = requireObject(readJson(aiResponse));
        JsonNode correctNode = root.get("is_correct");
        if (correctNode == null || !correctNode.isBoolean()) {
            throw new AIResponseParseException("Missing or invalid required field: is_correct");
        }
        String reason = getRequiredStringField(root, "judgment_reason");
        JsonNode explanationNode = root.get("explanation");
        String explanation = explanationNode != null && explanationNode.isTextual() ? explanationNode.asText() : "";
        return new RawJudgment(correctNode.asBoolean(), reason, explanation);
    }

    public PerformanceInsights parseInsights(String aiResponse) {
        JsonNode root = requireObject(readJson(aiResponse));
        return new PerformanceInsights(
                getRequiredStringField(root, "summary").trim(),
                getRequiredStringField(root, "recommendations").trim()
        );
    }

    String extractJson(String response) {
        if (response == null || response.isBlank()) {
            throw new AIResponseParseException("Empty response from AI service");
        }

        // Remove markdown code blocks
        String cleaned = response.trim()
                .replaceAll("```json\\s*", "")
                .replaceAll("```\\s*", "");

        int startBrace = cleaned.indexOf('{');
        int startBracket = cleaned.indexOf('[');
        if (startBrace == -1 && startBracket == -1) {
            throw new AIResponseParseException("No JSON content found in response");
        }

        boolean isObject = startBrace != -1 && (startBracket == -1 || startBrace < startBracket);
        char startChar = isObject ? '{' : '[';
        char endChar = isObject ? '}' : ']';
        int start = isObject ? startBrace : startBracket;

        int depth = 0;
        boolean inString = false;
        for (int i = start; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            if (c == '"' && cleaned.charAt(i - 1) != '\\') {
                inString = !inString;
            } else if (!inString && c == startChar) {
                depth++;
            } else if (!inString && c == endChar) {
                depth--;
                if (depth == 0) {
                    return cleaned.substring(start, i + 1);
                }
            }
        }
        throw new AIResponseParseException("Invalid JSON structure - unmatched braces");
    }

    private JsonNode readJson(String response) {
        String json = extractJson(response);
        try {
            return objectMapper.readTree(json);
        } catch (IOException e) {
            log.debug("Unparseable AI response: {}", response);
            throw new AIResponseParseException("Failed to parse AI response: " + e.getMessage(), e);
        }
    }

    private JsonNode requireObject(JsonNode node) {
        if (!node.isObject()) {
            throw new AIResponseParseException("Expected a JSON object in AI response");
        }
        return node;
    }

    private String getRequiredStringField(JsonNode node, String fieldName) {
        JsonNode fieldNode = node.get(fieldName);
        if (fieldNode == null || !fieldNode.isTextual() || fieldNode.asText().isBlank()) {
            throw new AIResponseParseException("Missing or invalid required field: " + fieldName);
        }
        return fieldNode.asText();
    }

    // Answers like 12 or 0.5 may come back as JSON numbers
    private String getRequiredScalarField(JsonNode node, String fieldName) {
        JsonNode fieldNode = node.get(fieldName);
        if (fieldNode == null || !fieldNode.isValueNode() || fieldNode.isNull() || fieldNode.asText().isBlank()) {
            throw new AIResponseParseException("Missing or invalid required field: " + fieldName);
        }
        return fieldNode.asText();
    }

    private int getRequiredIntField(JsonNode node, String fieldName) {
        JsonNode fieldNode = node.get(fieldName);
        if (fieldNode == null) {
            throw new AIResponseParseException("Missing required field: " + fieldName);
        }
        if (fieldNode.canConvertToInt()) {
            return fieldNode.asInt();
        }
        if (fieldNode.isTextual()) {
            try {
                return Integer.parseInt(fieldNode.asText().trim());
            } catch (NumberFormatException e) {
                throw new AIResponseParseException("Field " + fieldName + " is not a number", e);
            }
        }
        throw new AIResponseParseException("Invalid field: " + fieldName);
    }

    private int clampDifficulty(int value) {
        return Math.max(1, Math.min(5, value));
    }

    public record RawJudgment(boolean correct, String reason, String explanation) {
    }
}
