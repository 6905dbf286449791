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

import java.util.List;
import java.util.Locale;

/**
 * Image annotation and model training requests. Only a plan is drafted here; requests
 * without such intent get a description of what the node can do.
 */
@Component
@RequiredArgsConstructor
public class MultimarkHandler implements NodeHandler {

    private static final List<String> TRAINING_KEYWORDS   = List.of("train", "model", "训练", "模型");
    private static final List<String> ANNOTATION_KEYWORDS = List.of(
            "annotat", "label", "mark", "image", "photo", "picture", "标注", "识别", "图像", "照片", "图片");

    static final String CAPABILITIES = """
            Image annotation can:
            1. Recognise astronomical objects in an image
            2. Classify galaxies by morphology
            3. Generate scientific annotations for an image
            4. Plan the training of a new image model

            Say "annotate this image" or "train a model" to get a plan.""";

    private final ClassifierPort classifier;

    @Override
    public NodeId supportedNode() {
        return NodeId.MULTIMARK;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        String lower = userInput == null ? "" : userInput.toLowerCase(Locale.ROOT);
        boolean training   = TRAINING_KEYWORDS.stream().anyMatch(lower::contains);
        boolean annotation = ANNOTATION_KEYWORDS.stream().anyMatch(lower::contains);

        if (!training && !annotation) {
            return NodeResult.ok(SessionDelta.builder()
                    .answerText(CAPABILITIES)
                    .record(ExecutionRecord.of(NodeId.MULTIMARK, "multimark_info", userInput, "capabilities"))
                    .build(), NodeId.END);
        }

        String plan;
        try {
            plan = classifier.classify(NodePrompts.annotationPlan(userInput, training)).strip();
        } catch (ClassifierException e) {
            return NodeResult.err(ErrorInfo.of(NodeId.MULTIMARK, ErrorKind.CLASSIFIER, e.getMessage()));
        }
        String heading = training ? "Model training plan" : "Image annotation plan";
        String answer = heading + ":\n" + (plan.isEmpty() ? "No plan could be drafted." : plan);

        return NodeResult.ok(SessionDelta.builder()
                .answerText(answer)
                .record(ExecutionRecord.of(NodeId.MULTIMARK, training ? "training_plan" : "annotation_plan",
                        userInput, heading))
                .build(), NodeId.END);
    }
}
