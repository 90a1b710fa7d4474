package uk.gegc.adaptivequiz.features.session.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for quiz session lifecycle: scoring, idle expiry,
 * reaper scheduling and lock waits.
 */
@Data
@Component
@ConfigurationProperties(prefix = "quiz.session")
public class QuizSessionProperties {

    /**
     * Clients send a heartbeat every 30 seconds; the idle timeout must leave
     * room for at least one missed beat.
     */
    static final Duration MIN_IDLE_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Points added to the score for each correct answer.
     * Default: 1
     */
    private int pointsPerCorrect = 1;

    /**
     * Inactivity after which an active session is expired by the reaper.
     * Default: 30 minutes
     */
    private Duration idleTimeout = Duration.ofMinutes(30);

    /**
     * Fixed delay between reaper sweeps.
     * Default: 60 seconds
     */
    private Duration sweepInterval = Duration.ofSeconds(60);

    /**
     * How long a completed or expired session stays available for reports.
     * Default: 30 minutes
     */
    private Duration retention = Duration.ofMinutes(30);

    /**
     * Maximum wait for a session lock before the request is rejected as busy.
     * The lock is never held across oracle calls, so waits are short.
     * Default: 5 seconds
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    @PostConstruct
    void validate() {
        if (idleTimeout == null || idleTimeout.compareTo(MIN_IDLE_TIMEOUT) <= 0) {
            throw new IllegalStateException(
                    "quiz.session.idle-timeout must be greater than " + MIN_IDLE_TIMEOUT.getSeconds() + "s");
        }
        if (pointsPerCorrect < 1) {
            throw new IllegalStateException("quiz.session.points-per-correct must be positive");
        }
    }
}
