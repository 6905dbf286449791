package com.astroinsight.astroinsight_backend.handler.impl;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.handler.NodeHandler;
import com.astroinsight.astroinsight_backend.handler.NodePrompts;
import com.astroinsight.astroinsight_backend.handler.NodeResult;
import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.ErrorKind;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RetrievalHandler implements NodeHandler {

    private final ClassifierPort classifier;

    @Override
    public NodeId supportedNode() {
        return NodeId.RETRIEVAL;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        String draft;
        try {
            draft = classifier.classify(NodePrompts.retrieval(userInput)).strip();
        } catch (ClassifierException e) {
            return NodeResult.err(ErrorInfo.of(NodeId.RETRIEVAL, ErrorKind.CLASSIFIER, e.getMessage()));
        }
        String answer = draft.isEmpty() ? "No retrieval plan could be drafted for this request." : draft;
        return NodeResult.ok(SessionDelta.builder()
                .answerText(answer)
                .record(ExecutionRecord.of(NodeId.RETRIEVAL, "retrieval_draft", userInput, answer))
                .build(), NodeId.END);
    }
}
