package uk.gegc.adaptivequiz.features.session.domain.repository;

import uk.gegc.adaptivequiz.features.session.domain.model.QuizSession;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionSnapshot;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Holds live quiz sessions. Every read and write of a session happens inside
 * that session's critical section; distinct sessions never contend.
 */
public interface SessionStore {

    /**
     * Store a new session.
     *
     * @return the session id
     * @throws IllegalStateException if a session with the same id exists
     */
    String create(QuizSession session);

    /**
     * Immutable copy of the session, or empty if unknown or evicted.
     */
    Optional<SessionSnapshot> find(String sessionId);

    /**
     * Run {@code mutator} against the session while holding its lock.
     *
     * @throws uk.gegc.adaptivequiz.shared.exception.SessionNotFoundException if the session is unknown
     * @throws uk.gegc.adaptivequiz.shared.exception.SessionBusyException     if the lock could not be acquired in time
     */
    <T> T update(String sessionId, Function<QuizSession, T> mutator);

    /**
     * Stamp the session's last activity time.
     *
     * @throws uk.gegc.adaptivequiz.shared.exception.SessionTerminalException if the session is completed or expired
     */
    void touch(String sessionId);

    /**
     * Move an active session to EXPIRED.
     *
     * @return false if the session was already terminal
     */
    boolean expire(String sessionId);

    /**
     * Expire the session if it is still active and its last activity is
     * before {@code cutoff}. A session whose lock is currently held is left
     * for a later sweep.
     */
    boolean expireIfIdle(String sessionId, Instant cutoff);

    /**
     * Remove a terminal session that ended before {@code cutoff}.
     */
    boolean evictIfEndedBefore(String sessionId, Instant cutoff);

    /**
     * Weakly consistent view of the stored session ids.
     */
    Set<String> sessionIds();

    int size();
}
