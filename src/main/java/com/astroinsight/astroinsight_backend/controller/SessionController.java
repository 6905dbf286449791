package com.astroinsight.astroinsight_backend.controller;

import com.astroinsight.astroinsight_backend.model.dto.SessionHistory;
import com.astroinsight.astroinsight_backend.model.dto.SessionSnapshot;
import com.astroinsight.astroinsight_backend.model.dto.SessionSummary;
import com.astroinsight.astroinsight_backend.service.SessionRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry registry;

    // POST /api/sessions: open a session with its first message; a supplied id is reused if known
    @PostMapping
    public ResponseEntity<SessionSnapshot> create(@Valid @RequestBody CreateSessionRequest body) {
        SessionSnapshot snapshot = registry.createOrContinue(body.sessionId(), body.message(), body.context());
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshot);
    }

    // POST /api/sessions/{id}/messages: continue; resumes a waiting session where it stopped
    @PostMapping("/{id}/messages")
    public SessionSnapshot message(@PathVariable String id, @Valid @RequestBody MessageRequest body) {
        registry.get(id);  // 404 for unknown ids instead of silently creating one
        return registry.createOrContinue(id, body.message(), body.context());
    }

    // GET /api/sessions/{id}: latest snapshot
    @GetMapping("/{id}")
    public SessionSnapshot get(@PathVariable String id) {
        return registry.get(id);
    }

    // GET /api/sessions/{id}/history: visited nodes, node actions, dialogue turns
    @GetMapping("/{id}/history")
    public SessionHistory history(@PathVariable String id) {
        return registry.history(id);
    }

    // GET /api/sessions: all sessions, oldest first
    @GetMapping
    public List<SessionSummary> list() {
        return registry.list();
    }

    // POST /api/sessions/{id}/cancel: abort a running code execution
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        registry.cancel(id);
        return ResponseEntity.accepted().body(Map.of("sessionId", id, "cancelled", true));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        registry.remove(id);
        return ResponseEntity.noContent().build();
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record CreateSessionRequest(
            @Pattern(regexp = SessionRegistry.SESSION_ID_REGEX,
                     message = "must be 1-128 letters, digits, '_' or '-'") String sessionId,
            @NotNull @Size(max = 20_000) String message,
            Map<String, Object> context
    ) {}

    public record MessageRequest(
            @NotNull @Size(max = 20_000) String message,
            Map<String, Object> context
    ) {}
}
