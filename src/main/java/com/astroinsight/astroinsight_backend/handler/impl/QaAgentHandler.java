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
public class QaAgentHandler implements NodeHandler {

    private final ClassifierPort classifier;

    @Override
    public NodeId supportedNode() {
        return NodeId.QA_AGENT;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        String answer;
        try {
            answer = classifier.classify(NodePrompts.qa(userInput, session.getUserType())).strip();
        } catch (ClassifierException e) {
            return NodeResult.err(ErrorInfo.of(NodeId.QA_AGENT, ErrorKind.CLASSIFIER, e.getMessage()));
        }
        if (answer.isEmpty()) {
            answer = "I could not find an answer to that question. Could you rephrase it?";
        }
        return NodeResult.ok(SessionDelta.builder()
                .answerText(answer)
                .record(ExecutionRecord.of(NodeId.QA_AGENT, "qa_answer", userInput, answer))
                .build(), NodeId.END);
    }
}
