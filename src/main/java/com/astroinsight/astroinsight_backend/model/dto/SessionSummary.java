package com.astroinsight.astroinsight_backend.model.dto;

import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.TaskType;

import java.time.Instant;

public record SessionSummary(
        String   sessionId,
        NodeId   currentStep,
        boolean  isComplete,
        boolean  awaitingChoice,
        TaskType taskType,
        Instant  createdAt,
        Instant  updatedAt
) {

    public static SessionSummary of(Session s) {
        return new SessionSummary(s.getSessionId(), s.getCurrentStep(), s.isComplete(),
                s.isAwaitingUserChoice(), s.getTaskType(), s.getCreatedAt(), s.getUpdatedAt());
    }
}
