package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.model.session.ErrorInfo;
import com.astroinsight.astroinsight_backend.model.session.ErrorKind;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import com.astroinsight.astroinsight_backend.model.session.UserType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Labels the user amateur or professional. Amateurs go to Q&A, professionals to task selection.
 * An unrecognised reply is resolved by substring, then defaults to amateur; so does a classifier failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityCheckHandler implements NodeHandler {

    private final ClassifierPort classifier;

    @Override
    public NodeId supportedNode() {
        return NodeId.IDENTITY_CHECK;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return NodeResult.err(ErrorInfo.of(NodeId.IDENTITY_CHECK, ErrorKind.INPUT, "Empty input"));
        }

        String raw;
        try {
            raw = classifier.classify(NodePrompts.identity(userInput));
        } catch (ClassifierException e) {
            log.warn("[{}] Identity classification failed, assuming amateur: {}", session.getSessionId(), e.getMessage());
            raw = "";
        }
        UserType userType = resolve(raw);
        NodeId next = userType == UserType.PROFESSIONAL ? NodeId.TASK_SELECTOR : NodeId.QA_AGENT;

        return NodeResult.ok(SessionDelta.builder()
                .userType(userType)
                .record(ExecutionRecord.of(NodeId.IDENTITY_CHECK, "identity_check", userInput, userType.getLabel()))
                .build(), next);
    }

    static UserType resolve(String raw) {
        return UserType.fromLabel(raw).orElseGet(() -> {
            String lower = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
            if (lower.contains("professional") || lower.contains("专业")) return UserType.PROFESSIONAL;
            if (!lower.contains("amateur") && !lower.contains("爱好者") && !lower.contains("业余")) {
                log.warn("Unrecognised identity label '{}', defaulting to amateur", raw);
            }
            return UserType.AMATEUR;
        });
    }
}
