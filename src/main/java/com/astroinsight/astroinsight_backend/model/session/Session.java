package com.astroinsight.astroinsight_backend.model.session;

import com.astroinsight.astroinsight_backend.model.code.CodeTask;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The record threaded through the router for one user interaction thread.
 *
 * {@code currentStep} is written by the router only, {@code retryCount} by error recovery only;
 * both rules are enforced by convention through {@link SessionDelta}, not by the type system.
 * Instances are guarded by the registry's per-session lock and are not thread-safe on their own.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Session {

    private final String sessionId;

    @Builder.Default
    private NodeId currentStep = NodeId.IDENTITY_CHECK;

    @Builder.Default
    private List<NodeId> nodeHistory = new ArrayList<>();

    private int     retryCount;
    private NodeId  lastErrorNode;
    private boolean complete;
    private boolean awaitingUserChoice;

    private ErrorInfo errorInfo;

    @Builder.Default
    private List<ExecutionRecord> executionHistory = new ArrayList<>();

    private DialogueState dialogue;

    // ── Request-scoped fields ──────────────────────────────────────────────

    private String   userInput;
    private UserType userType;
    private TaskType taskType;
    private String   answerText;

    private ClassificationResult classification;
    private CodeTask             codeTask;

    private String generatedCode;

    @Builder.Default
    private List<String> generatedFiles = new ArrayList<>();

    @Builder.Default
    private List<String> generatedTexts = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> context = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    public static Session create(String sessionId, Map<String, Object> context) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = Instant.now();
        return Session.builder()
                .sessionId(sessionId)
                .context(context != null ? new HashMap<>(context) : new HashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Merges a handler's delta. Does not touch {@code currentStep} or {@code nodeHistory};
     * those belong to the router.
     */
    public void apply(SessionDelta delta) {
        if (delta == null) return;
        if (delta.getComplete() != null)           complete = delta.getComplete();
        if (delta.getAwaitingUserChoice() != null) awaitingUserChoice = delta.getAwaitingUserChoice();
        if (delta.getUserType() != null)           userType = delta.getUserType();
        if (delta.getTaskType() != null)           taskType = delta.getTaskType();
        if (delta.getAnswerText() != null)         answerText = delta.getAnswerText();
        if (delta.getRetryCount() != null)         retryCount = delta.getRetryCount();
        if (delta.getLastErrorNode() != null)      lastErrorNode = delta.getLastErrorNode();
        if (delta.isClearErrorInfo())              errorInfo = null;
        if (delta.getErrorInfo() != null)          errorInfo = delta.getErrorInfo();
        if (delta.getDialogue() != null)           dialogue = delta.getDialogue();
        if (delta.getCodeTask() != null)           codeTask = delta.getCodeTask();
        if (delta.getClassification() != null)     classification = delta.getClassification();
        if (delta.getGeneratedCode() != null)      generatedCode = delta.getGeneratedCode();
        if (delta.getGeneratedFiles() != null)     generatedFiles = new ArrayList<>(delta.getGeneratedFiles());
        if (delta.getGeneratedTexts() != null)     generatedTexts = new ArrayList<>(delta.getGeneratedTexts());
        if (delta.getRecords() != null)            executionHistory.addAll(delta.getRecords());
        updatedAt = Instant.now();
    }

    /** Appends an audit entry outside of any handler (registry input rejection, router errors). */
    public void record(ExecutionRecord entry) {
        executionHistory.add(entry);
        updatedAt = Instant.now();
    }

    /**
     * Opens a new request on a finished session: error and retry state are reset,
     * histories are kept.
     */
    public void beginNewRequest(String input) {
        userInput          = input;
        currentStep        = NodeId.IDENTITY_CHECK;
        complete           = false;
        awaitingUserChoice = false;
        errorInfo          = null;
        retryCount         = 0;
        lastErrorNode      = null;
        answerText         = null;
        taskType           = null;
        classification     = null;
        codeTask           = null;
        dialogue           = null;
        generatedCode      = null;
        generatedFiles     = new ArrayList<>();
        generatedTexts     = new ArrayList<>();
        updatedAt          = Instant.now();
    }
}
