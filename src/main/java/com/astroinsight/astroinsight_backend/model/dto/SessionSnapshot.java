package com.astroinsight.astroinsight_backend.model.dto;

import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.TaskType;
import com.astroinsight.astroinsight_backend.model.session.UserType;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Read-only view of a session handed back to front ends after every call.
 * Copies collections so callers never see later mutations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshot(
        String       sessionId,
        NodeId       currentStep,
        boolean      isComplete,
        boolean      awaitingChoice,
        String       answerText,
        List<String> generatedFiles,
        List<String> generatedTexts,
        String       generatedCode,
        UserType     userType,
        TaskType     taskType,
        int          retryCount,
        ErrorInfo    errorInfo,
        Integer      dialogueTurn
) {

    public static SessionSnapshot of(Session s) {
        return new SessionSnapshot(
                s.getSessionId(),
                s.getCurrentStep(),
                s.isComplete(),
                s.isAwaitingUserChoice(),
                s.getAnswerText(),
                List.copyOf(s.getGeneratedFiles()),
                List.copyOf(s.getGeneratedTexts()),
                s.getGeneratedCode(),
                s.getUserType(),
                s.getTaskType(),
                s.getRetryCount(),
                s.getErrorInfo(),
                s.getDialogue() != null ? s.getDialogue().getTurnCount() : null
        );
    }
}
