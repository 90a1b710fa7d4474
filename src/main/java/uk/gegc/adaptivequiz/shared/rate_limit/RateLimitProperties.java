package uk.gegc.adaptivequiz.shared.rate_limit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-client request limits for the quiz endpoints.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.rate-limit")
public class RateLimitProperties {

    /**
     * Quiz starts allowed per client per minute.
     */
    private int startPerMinute = 3;

    /**
     * Answer submissions allowed per client per minute.
     */
    private int answerPerMinute = 10;

    /**
     * Requests allowed per client per minute on every other quiz endpoint
     * (heartbeat, recover, report).
     */
    private int defaultPerMinute = 30;
}
