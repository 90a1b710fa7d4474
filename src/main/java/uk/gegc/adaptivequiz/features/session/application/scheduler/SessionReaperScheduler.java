package uk.gegc.adaptivequiz.features.session.application.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivequiz.features.session.config.QuizSessionProperties;
import uk.gegc.adaptivequiz.features.session.domain.repository.SessionStore;

import java.time.Clock;
import java.time.Instant;

/**
 * Scheduler that expires idle quiz sessions and evicts ended ones once their
 * report retention window has passed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionReaperScheduler {

    private final SessionStore sessionStore;
    private final QuizSessionProperties properties;
    private final Clock clock;

    /**
     * Runs at a fixed delay configured by quiz.session.sweep-interval.
     * Default: 60 seconds
     */
    @Scheduled(fixedDelayString = "#{@quizSessionProperties.sweepInterval.toMillis()}",
            initialDelayString = "#{@quizSessionProperties.sweepInterval.toMillis()}")
    public void reapSessions() {
        log.debug("Running scheduled sweep of quiz sessions");
        try {
            sweep();
        } catch (Exception e) {
            log.error("Error during scheduled sweep of quiz sessions", e);
            // Don't propagate exception to prevent scheduler from stopping
        }
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        Instant idleCutoff = now.minus(properties.getIdleTimeout());
        Instant retentionCutoff = now.minus(properties.getRetention());

        int expired = 0;
        int evicted = 0;
        for (String sessionId : sessionStore.sessionIds()) {
            try {
                if (sessionStore.expireIfIdle(sessionId, idleCutoff)) {
                    expired++;
                    log.info("Session {} expired after {} of inactivity", sessionId, properties.getIdleTimeout());
                }
                if (sessionStore.evictIfEndedBefore(sessionId, retentionCutoff)) {
                    evicted++;
                    log.info("Session {} evicted after retention window", sessionId);
                }
            } catch (RuntimeException e) {
                log.error("Failed to sweep session {}", sessionId, e);
            }
        }

        if (expired > 0 || evicted > 0) {
            log.info("Session sweep finished: {} expired, {} evicted, {} remaining",
                    expired, evicted, sessionStore.size());
        }
        return new SweepResult(expired, evicted);
    }

    public record SweepResult(int expired, int evicted) {
    }
}
