package com.astroinsight.astroinsight_backend.model.session;

import com.astroinsight.astroinsight_backend.model.code.CodeTask;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * State update returned by a node handler. Null fields mean "leave as is".
 * History entries are appended, never replace existing ones.
 */
@Data
@Builder(toBuilder = true)
public class SessionDelta {

    private Boolean complete;
    private Boolean awaitingUserChoice;

    private UserType userType;
    private TaskType taskType;
    private String   answerText;

    private Integer   retryCount;
    private NodeId    lastErrorNode;
    private ErrorInfo errorInfo;
    private boolean   clearErrorInfo;

    private DialogueState        dialogue;
    private CodeTask             codeTask;
    private ClassificationResult classification;

    private String       generatedCode;
    private List<String> generatedFiles;
    private List<String> generatedTexts;

    @Singular
    private List<ExecutionRecord> records;

    public static SessionDelta empty() {
        return SessionDelta.builder().build();
    }
}
