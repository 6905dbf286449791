package com.astroinsight.astroinsight_backend.service;

import com.astroinsight.astroinsight_backend.engine.CancellationRegistry;
import com.astroinsight.astroinsight_backend.engine.SessionRouter;
import com.astroinsight.astroinsight_backend.exception.SessionNotFoundException;
import com.astroinsight.astroinsight_backend.model.dto.SessionHistory;
import com.astroinsight.astroinsight_backend.model.dto.SessionSnapshot;
import com.astroinsight.astroinsight_backend.model.dto.SessionSummary;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.Session;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * In-memory home of all sessions and the single entry point for user input.
 *
 * Calls for the same session id are serialized by a per-session lock; different sessions
 * dispatch in parallel on their callers' threads. Cancellation bypasses the lock
 * so it can reach a dispatch that is still running.
 *
 * Locks exist only for live sessions. Removing a session retires its lock while holding it;
 * callers that were queued on a retired lock start over with the current one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRegistry {

    static final String EMPTY_INPUT_PROMPT = "Please enter a question or request.";

    /** Session ids name artifact directories, so they are restricted to one safe path segment. */
    public static final String SESSION_ID_REGEX = "[A-Za-z0-9_-]{1,128}";
    private static final Pattern SESSION_ID = Pattern.compile(SESSION_ID_REGEX);

    private final SessionRouter        router;
    private final CancellationRegistry cancellations;

    private final Map<String, Session>       sessions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks    = new ConcurrentHashMap<>();

    // ── Public API ────────────────────────────────────────────────────────────

    /**
     * Creates the session when the id is unknown (or null), then feeds it the input:
     * a finished session starts a new request, a waiting one resumes where it stopped.
     * Blank input never moves the session.
     */
    public SessionSnapshot createOrContinue(String sessionId, String userInput, Map<String, Object> context) {
        String id = sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
        if (!SESSION_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid session id: only letters, digits, '_' and '-' are allowed (max 128)");
        }

        return withLock(id, true, () -> {
            Session session = sessions.computeIfAbsent(id, key -> {
                log.info("Session {} created", key);
                return Session.create(key, context);
            });
            if (context != null) {
                session.getContext().putAll(context);
            }

            if (userInput == null || userInput.isBlank()) {
                log.warn("[{}] Empty input ignored at {}", id, session.getCurrentStep());
                session.record(ExecutionRecord.of(session.getCurrentStep(), "invalid_input", userInput, EMPTY_INPUT_PROMPT));
                session.setAnswerText(EMPTY_INPUT_PROMPT);
                return SessionSnapshot.of(session);
            }

            String input = userInput.strip();
            if (session.isComplete()) {
                session.beginNewRequest(input);
            } else {
                session.setUserInput(input);
            }
            cancellations.tokenFor(id).reset();

            router.dispatch(session, input);
            return SessionSnapshot.of(session);
        });
    }

    public SessionSnapshot get(String sessionId) {
        return withLock(sessionId, false, () -> SessionSnapshot.of(require(sessionId)));
    }

    public SessionHistory history(String sessionId) {
        return withLock(sessionId, false, () -> SessionHistory.of(require(sessionId)));
    }

    public List<SessionSummary> list() {
        return sessions.keySet().stream()
                .map(id -> withLockIfPresent(id, () -> {
                    Session s = sessions.get(id);
                    return s != null ? SessionSummary.of(s) : null;
                }))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(SessionSummary::createdAt))
                .collect(Collectors.toList());
    }

    /** Aborts a running code execution of this session; the dispatch then ends normally. */
    public void cancel(String sessionId) {
        if (!sessions.containsKey(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        cancellations.tokenFor(sessionId).cancel();
        log.info("[{}] Cancellation requested", sessionId);
    }

    public void remove(String sessionId) {
        if (!sessions.containsKey(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        // Abort a running execution first, otherwise the lock below waits for it
        cancellations.cancel(sessionId);
        withLock(sessionId, false, () -> {
            if (sessions.remove(sessionId) == null) {
                throw new SessionNotFoundException(sessionId);
            }
            cancellations.remove(sessionId);
            locks.remove(sessionId);
            log.info("Session {} removed", sessionId);
            return null;
        });
    }

    /** Number of live per-session locks; one per existing session once calls settle. */
    int lockCount() {
        return locks.size();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Session require(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) throw new SessionNotFoundException(sessionId);
        return session;
    }

    /**
     * Runs the action under the session's lock. Only {@code create} calls may add a lock;
     * the others fail with {@link SessionNotFoundException} for unknown ids.
     */
    private <T> T withLock(String sessionId, boolean create, Supplier<T> action) {
        return locked(sessionId, create, action, true);
    }

    private <T> T withLockIfPresent(String sessionId, Supplier<T> action) {
        return locked(sessionId, false, action, false);
    }

    private <T> T locked(String sessionId, boolean create, Supplier<T> action, boolean required) {
        while (true) {
            ReentrantLock lock = create
                    ? locks.computeIfAbsent(sessionId, key -> new ReentrantLock())
                    : locks.get(sessionId);
            if (lock == null) {
                if (required) throw new SessionNotFoundException(sessionId);
                return null;
            }
            lock.lock();
            try {
                // Retired by remove() while we were queued: retry with whatever lock is current
                if (locks.get(sessionId) == lock) {
                    return action.get();
                }
            } finally {
                lock.unlock();
            }
        }
    }
}
