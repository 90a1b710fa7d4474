package uk.gegc.adaptivequiz.features.oracle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for calls to the content oracle.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.oracle")
public class OracleProperties {

    /**
     * Upper bound for a single oracle call.
     * Default: 20 seconds
     */
    private Duration callTimeout = Duration.ofSeconds(20);

    /**
     * Attempts per oracle call, including the first one.
     * Default: 2 (one retry)
     */
    private int maxAttempts = 2;

    /**
     * How many times a question already asked in the session is re-requested
     * before it is accepted anyway.
     */
    private int duplicateQuestionRetries = 2;

    /**
     * Number of previously asked questions included in the generation prompt.
     */
    private int recentQuestionsInPrompt = 5;
}
