package com.astroinsight.astroinsight_backend.engine;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** One {@link CancellationToken} per session id, created on first use. */
@Component
public class CancellationRegistry {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken tokenFor(String sessionId) {
        return tokens.computeIfAbsent(sessionId, id -> new CancellationToken());
    }

    /** @return false when the session never had a token */
    public boolean cancel(String sessionId) {
        CancellationToken token = tokens.get(sessionId);
        if (token == null) return false;
        token.cancel();
        return true;
    }

    public void remove(String sessionId) {
        tokens.remove(sessionId);
    }
}
