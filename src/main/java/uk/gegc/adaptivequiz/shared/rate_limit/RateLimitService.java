package uk.gegc.adaptivequiz.shared.rate_limit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.adaptivequiz.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed one-minute window limiter keyed by operation and client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimitService {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastCleanup = new AtomicReference<>(Instant.MIN);

    public void checkRateLimit(String operation, String key, int limitPerMinute) {
        String rateLimitKey = operation + ":" + key;
        Instant now = clock.instant();
        Instant windowStartCutoff = now.minus(WINDOW);

        cleanUpExpiredWindows(now, windowStartCutoff);

        Window updated = windows.compute(rateLimitKey, (k, current) -> {
            if (current == null || !current.start().isAfter(windowStartCutoff)) {
                return new Window(now, 1);
            }
            return new Window(current.start(), current.count() + 1);
        });

        if (updated.count() > limitPerMinute) {
            long retryAfter = Duration.between(now, updated.start().plus(WINDOW)).getSeconds();
            log.warn("Rate limit exceeded for {} by {}", operation, key);
            throw new RateLimitExceededException("Too many requests for " + operation, retryAfter);
        }
    }

    /**
     * Drops closed windows at most once per window length, by whichever caller
     * wins the race for it.
     */
    private void cleanUpExpiredWindows(Instant now, Instant windowStartCutoff) {
        Instant previous = lastCleanup.get();
        if (previous.isAfter(windowStartCutoff) || !lastCleanup.compareAndSet(previous, now)) {
            return;
        }
        int before = windows.size();
        windows.entrySet().removeIf(entry -> !entry.getValue().start().isAfter(windowStartCutoff));
        log.debug("Rate limit cleanup removed {} expired windows", before - windows.size());
    }

    int trackedWindows() {
        return windows.size();
    }

    private record Window(Instant start, int count) {
    }
}
