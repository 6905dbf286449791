package com.astroinsight.astroinsight_backend.handler;

import com.astroinsight.astroinsight_backend.classifier.ClassifierPort;
import com.astroinsight.astroinsight_backend.exception.ClassifierException;
import com.astroinsight.astroinsight_backend.model.session.ExecutionRecord;
import com.astroinsight.astroinsight_backend.model.session.NodeId;
import com.astroinsight.astroinsight_backend.model.session.Session;
import com.astroinsight.astroinsight_backend.model.session.SessionDelta;
import com.astroinsight.astroinsight_backend.model.session.TaskType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class TaskSelectorHandler implements NodeHandler {

    // Checked in order; the first hit wins
    private static final Map<TaskType, List<String>> HINTS = new LinkedHashMap<>();

    static {
        HINTS.put(TaskType.CLASSIFICATION, List.of("classif", "分类"));
        HINTS.put(TaskType.RETRIEVAL,      List.of("retriev", "检索", "查询"));
        HINTS.put(TaskType.VISUALIZATION,  List.of("visual", "可视化", "图表", "绘制"));
        HINTS.put(TaskType.MULTIMARK,      List.of("multimark", "标注", "图像", "图片", "训练"));
    }

    private final ClassifierPort classifier;

    @Override
    public NodeId supportedNode() {
        return NodeId.TASK_SELECTOR;
    }

    @Override
    public NodeResult handle(Session session, String userInput) {
        String raw;
        try {
            raw = classifier.classify(NodePrompts.taskSelection(userInput));
        } catch (ClassifierException e) {
            log.warn("[{}] Task selection failed, defaulting to classification: {}", session.getSessionId(), e.getMessage());
            raw = "";
        }
        TaskType taskType = resolve(raw);

        return NodeResult.ok(SessionDelta.builder()
                .taskType(taskType)
                .record(ExecutionRecord.of(NodeId.TASK_SELECTOR, "task_selection", userInput, taskType.getLabel()))
                .build(), taskType.getNode());
    }

    static TaskType resolve(String raw) {
        return TaskType.fromLabel(raw).orElseGet(() -> {
            String lower = raw == null ? "" : raw.toLowerCase(Locale.ROOT);
            for (Map.Entry<TaskType, List<String>> e : HINTS.entrySet()) {
                if (e.getValue().stream().anyMatch(lower::contains)) return e.getKey();
            }
            log.warn("Unrecognised task label '{}', defaulting to classification", raw);
            return TaskType.CLASSIFICATION;
        });
    }
}
