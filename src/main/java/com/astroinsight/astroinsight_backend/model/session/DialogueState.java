package com.astroinsight.astroinsight_backend.model.session;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Multi-turn clarification sub-state, present only while the visualization task is talking to the user. */
@Data
@Builder
public class DialogueState {

    public enum Status { CLARIFYING, COMPLETED, CANCELLED }

    private String dialogueId;
    private String originalRequest;
    private int    turnCount;
    private int    maxTurns;

    @Builder.Default
    private Status status = Status.CLARIFYING;

    @Builder.Default
    private List<DialogueTurn> history = new ArrayList<>();

    @Builder.Default
    private Requirements requirements = new Requirements();

    public boolean isOpen() {
        return status == Status.CLARIFYING;
    }

    /** Detached copy; history and requirements are not shared with the original. */
    public DialogueState copy() {
        Requirements req = new Requirements();
        req.merge(requirements);
        return DialogueState.builder()
                .dialogueId(dialogueId)
                .originalRequest(originalRequest)
                .turnCount(turnCount)
                .maxTurns(maxTurns)
                .status(status)
                .history(new ArrayList<>(history))
                .requirements(req)
                .build();
    }
}
