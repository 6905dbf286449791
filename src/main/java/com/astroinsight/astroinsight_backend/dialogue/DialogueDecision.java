package com.astroinsight.astroinsight_backend.dialogue;

import com.astroinsight.astroinsight_backend.model.session.DialogueState;

/**
 * What the visualization node should do after one dialogue step.
 * ASK and CONFIRM keep the dialogue open and suspend; PROCEED and CANCEL close it.
 */
public record DialogueDecision(Action action, String reply, DialogueState state) {

    public enum Action {
        ASK,
        CONFIRM,
        PROCEED,
        CANCEL;

        public boolean suspends() {
            return this == ASK || this == CONFIRM;
        }
    }
}
