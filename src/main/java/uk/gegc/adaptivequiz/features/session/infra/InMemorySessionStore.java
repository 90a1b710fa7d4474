package uk.gegc.adaptivequiz.features.session.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import uk.gegc.adaptivequiz.features.session.config.QuizSessionProperties;
import uk.gegc.adaptivequiz.features.session.domain.model.QuizSession;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionSnapshot;
import uk.gegc.adaptivequiz.features.session.domain.model.SessionStatus;
import uk.gegc.adaptivequiz.features.session.domain.repository.SessionStore;
import uk.gegc.adaptivequiz.shared.exception.SessionBusyException;
import uk.gegc.adaptivequiz.shared.exception.SessionNotFoundException;
import uk.gegc.adaptivequiz.shared.exception.SessionTerminalException;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link SessionStore} keeping sessions in process memory, one lock per session.
 */
@Repository
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentMap<String, SessionSlot> slots = new ConcurrentHashMap<>();
    private final Clock clock;
    private final QuizSessionProperties properties;

    public InMemorySessionStore(Clock clock, QuizSessionProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public String create(QuizSession session) {
        if (session.getSessionId() == null || session.getSessionId().isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        if (session.getLastActivityAt() == null) {
            session.setLastActivityAt(clock.instant());
        }
        SessionSlot existing = slots.putIfAbsent(session.getSessionId(), new SessionSlot(session));
        if (existing != null) {
            throw new IllegalStateException("Session " + session.getSessionId() + " already exists");
        }
        return session.getSessionId();
    }

    @Override
    public Optional<SessionSnapshot> find(String sessionId) {
        SessionSlot slot = sessionId == null ? null : slots.get(sessionId);
        if (slot == null) {
            return Optional.empty();
        }
        acquire(slot, sessionId);
        try {
            return slot.evicted ? Optional.empty() : Optional.of(SessionSnapshot.of(slot.session));
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public <T> T update(String sessionId, Function<QuizSession, T> mutator) {
        SessionSlot slot = requireSlot(sessionId);
        acquire(slot, sessionId);
        try {
            if (slot.evicted) {
                throw new SessionNotFoundException(sessionId);
            }
            return mutator.apply(slot.session);
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public void touch(String sessionId) {
        update(sessionId, session -> {
            if (session.getStatus().isTerminal()) {
                throw new SessionTerminalException(sessionId, session.getStatus());
            }
            session.setLastActivityAt(clock.instant());
            return null;
        });
    }

    @Override
    public boolean expire(String sessionId) {
        return update(sessionId, this::markExpired);
    }

    @Override
    public boolean expireIfIdle(String sessionId, Instant cutoff) {
        SessionSlot slot = slots.get(sessionId);
        if (slot == null) {
            return false;
        }
        // Busy sessions are being worked on, so they are not idle
        if (!slot.lock.tryLock()) {
            log.debug("Session {} is busy, skipping idle check", sessionId);
            return false;
        }
        try {
            QuizSession session = slot.session;
            if (slot.evicted || session.getStatus() != SessionStatus.ACTIVE || session.isAnswerInFlight()) {
                return false;
            }
            if (!session.getLastActivityAt().isBefore(cutoff)) {
                return false;
            }
            return markExpired(session);
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public boolean evictIfEndedBefore(String sessionId, Instant cutoff) {
        SessionSlot slot = slots.get(sessionId);
        if (slot == null || !slot.lock.tryLock()) {
            return false;
        }
        try {
            QuizSession session = slot.session;
            if (slot.evicted || !session.getStatus().isTerminal()
                    || session.getEndedAt() == null || !session.getEndedAt().isBefore(cutoff)) {
                return false;
            }
            slot.evicted = true;
            slots.remove(sessionId, slot);
            return true;
        } finally {
            slot.lock.unlock();
        }
    }

    @Override
    public Set<String> sessionIds() {
        return Collections.unmodifiableSet(slots.keySet());
    }

    @Override
    public int size() {
        return slots.size();
    }

    private boolean markExpired(QuizSession session) {
        if (session.getStatus().isTerminal()) {
            return false;
        }
        session.setStatus(SessionStatus.EXPIRED);
        session.setEndedAt(clock.instant());
        return true;
    }

    private SessionSlot requireSlot(String sessionId) {
        SessionSlot slot = sessionId == null ? null : slots.get(sessionId);
        if (slot == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return slot;
    }

    private void acquire(SessionSlot slot, String sessionId) {
        try {
            if (!slot.lock.tryLock(properties.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting for lock on session {}", sessionId);
                throw new SessionBusyException(sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionBusyException(sessionId);
        }
    }

    private static final class SessionSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private final QuizSession session;
        private boolean evicted;

        private SessionSlot(QuizSession session) {
            this.session = session;
        }
    }
}
