package com.astroinsight.astroinsight_backend.model.dto;

import com.astroinsight.astroinsight_backend.model.session.DialogueTurn;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;

import java.util.List;

/** Audit view of a session: visited nodes, node actions and the current dialogue. */
public record SessionHistory(
        String                sessionId,
        List<NodeId>          nodeHistory,
        List<ExecutionRecord> executionHistory,
        List<DialogueTurn>    dialogueTurns
) {

    public static SessionHistory of(Session s) {
        return new SessionHistory(
                s.getSessionId(),
                List.copyOf(s.getNodeHistory()),
                List.copyOf(s.getExecutionHistory()),
                s.getDialogue() != null ? List.copyOf(s.getDialogue().getHistory()) : List.of());
    }
}
