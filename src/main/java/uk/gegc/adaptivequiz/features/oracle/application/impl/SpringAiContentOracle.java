package uk.gegc.adaptivequiz.features.oracle.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivequiz.features.oracle.application.ContentOracle;
import uk.gegc.adaptivequiz.features.oracle.application.PromptTemplateService;
import uk.gegc.adaptivequiz.features.oracle.domain.model.*;
import uk.gegc.adaptivequiz.features.oracle.infra.parser.OracleResponseParser;
import uk.gegc.adaptivequiz.features.report.domain.model.SkillPerformance;
import uk.gegc.adaptivequiz.features.session.domain.model.Topic;
import uk.gegc.adaptivequiz.shared.exception.AIResponseParseException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ContentOracle} backed by an LLM through Spring AI.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpringAiContentOracle implements ContentOracle {

    static final int MIN_EXPLANATION_LENGTH = 30;

    private final ChatClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final OracleResponseParser responseParser;

    @Override
    public List<MathConcept> planConcepts(Topic topic) {
        String prompt = promptTemplateService.render("concept-plan.txt", Map.of(
                "topic", topic.getDisplayName()
        ));
        List<MathConcept> concepts = responseParser.parseConcepts(send(prompt));
        log.info("Planned concepts for {}: {}", topic,
                concepts.stream().map(MathConcept::name).collect(Collectors.toList()));
        return concepts;
    }

    @Override
    public GeneratedQuestion generateQuestion(QuestionRequest request) {
        String skillInstruction = request.skillHint() != null
                ? "Concept = " + request.skillHint()
                : "Concept = any concept of the topic suited to the difficulty";
        String recent = request.recentQuestions().isEmpty()
                ? "No questions asked yet."
                : String.join("; ", request.recentQuestions());

        String prompt = promptTemplateService.render("question-generation.txt", Map.of(
                "topic", request.topic().getDisplayName(),
                "difficulty", String.valueOf(request.difficulty()),
                "skillInstruction", skillInstruction,
                "skill", request.skillHint() != null ? request.skillHint() : "<concept name>",
                "recentQuestions", recent
        ));

        GeneratedQuestion generated = responseParser.parseQuestion(send(prompt));

        if (request.skillHint() != null && !request.skillHint().equals(generated.skill())) {
            log.warn("Skill mismatch: model returned '{}', expected '{}'. Forcing override.",
                    generated.skill(), request.skillHint());
            generated = new GeneratedQuestion(
                    generated.question(),
                    generated.correctAnswer(),
                    generated.explanation(),
                    request.skillHint(),
                    generated.difficulty()
            );
        }
        return generated;
    }

    @Override
    public Judgment judge(String question, String correctAnswer, String userAnswer) {
        String prompt = promptTemplateService.render("answer-judging.txt", Map.of(
                "question", question,
                "correctAnswer", correctAnswer,
                "userAnswer", userAnswer
        ));

        OracleResponseParser.RawJudgment raw = responseParser.parseJudgment(send(prompt));

        String explanation = raw.explanation() == null ? "" : raw.explanation().trim();
        if (explanation.length() < MIN_EXPLANATION_LENGTH) {
            log.warn("Model gave an insufficient explanation for answer '{}' (correct '{}'). Using fallback.",
                    userAnswer, correctAnswer);
            explanation = fallbackExplanation(raw.correct(), correctAnswer, userAnswer);
        }

        String judgmentText = (raw.correct() ? "Correct" : "Incorrect") + " (" + raw.reason().trim() + ")";
        return new Judgment(raw.correct(), judgmentText, explanation);
    }

    @Override
    public PerformanceInsights generateInsights(InsightsRequest request) {
        String breakdown = request.skills().isEmpty()
                ? "- No questions were answered."
                : request.skills().stream()
                .map(this::describeSkill)
                .collect(Collectors.joining("\n"));

        String prompt = promptTemplateService.render("performance-insights.txt", Map.of(
                "username", request.username(),
                "topic", request.topic().getDisplayName(),
                "percentageScore", String.format(Locale.ROOT, "%.1f", request.percentageScore()),
                "skillBreakdown", breakdown
        ));
        return responseParser.parseInsights(send(prompt));
    }

    private String send(String prompt) {
        Instant start = Instant.now();
        ChatResponse response = chatClient.prompt()
                .user(prompt)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AIResponseParseException("No response received from AI service");
        }
        String text = response.getResult().getOutput().getText();
        if (text == null || text.isBlank()) {
            throw new AIResponseParseException("Empty response received from AI service");
        }

        log.debug("AI response received in {}ms", Duration.between(start, Instant.now()).toMillis());
        return text;
    }

    private String describeSkill(SkillPerformance skill) {
        return String.format(Locale.ROOT, "- %s: %d out of %d correct (%.1f%%)",
                skill.skill(), skill.correct(), skill.total(), skill.percentage());
    }

    private String fallbackExplanation(boolean correct, String correctAnswer, String userAnswer) {
        if (correct) {
            return "Your answer '" + userAnswer + "' is correct! The step-by-step solution confirms your result. Well done!";
        }
        return "Your answer '" + userAnswer + "' is incorrect. The correct answer is '" + correctAnswer + "'. "
                + "Please carefully review the solution steps; there might be a calculation error "
                + "or a misunderstanding of the concept involved.";
    }
}
