package com.astroinsight.astroinsight_backend.model.code;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One generate → validate → execute → rewrite cycle for a single request.
 *
 * The owning session is referenced by id only. {@code attempt} always equals
 * {@code codeHistory.size()} once code has been generated; only {@link #addGeneratedCode}
 * moves it.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CodeTask {

    private String taskId;
    private String sessionId;
    private String request;

    private DatasetInfo dataset;
    private Complexity  complexity;

    @Builder.Default
    private CodeTaskStatus status = CodeTaskStatus.DATASET_SELECTION;

    @Builder.Default
    private List<CodeAttempt> codeHistory = new ArrayList<>();

    @Builder.Default
    private List<ExecutionResult> executionHistory = new ArrayList<>();

    @Builder.Default
    private List<CodeError> errors = new ArrayList<>();

    private int attempt;

    private CodeErrorType failureType;
    private String        failureMessage;

    private Instant startedAt;
    private Instant completedAt;

    public static CodeTask create(String sessionId, String request) {
        return CodeTask.builder()
                .taskId(UUID.randomUUID().toString().substring(0, 8))
                .sessionId(sessionId)
                .request(request)
                .startedAt(Instant.now())
                .build();
    }

    public void addGeneratedCode(String code) {
        codeHistory.add(new CodeAttempt(code, codeHistory.size() + 1));
        attempt = codeHistory.size();
    }

    public void recordError(CodeErrorType type, String code, String message) {
        errors.add(new CodeError(type, code, message, attempt));
    }

    public void complete() {
        status      = CodeTaskStatus.COMPLETED;
        completedAt = Instant.now();
    }

    public void fail(CodeErrorType type, String message) {
        status         = CodeTaskStatus.FAILED;
        failureType    = type;
        failureMessage = message;
        completedAt    = Instant.now();
    }

    @JsonIgnore
    public String getLatestCode() {
        return codeHistory.isEmpty() ? null : codeHistory.get(codeHistory.size() - 1).code();
    }

    @JsonIgnore
    public ExecutionResult getLatestResult() {
        return executionHistory.isEmpty() ? null : executionHistory.get(executionHistory.size() - 1);
    }

    @JsonIgnore
    public boolean isSucceeded() {
        return status == CodeTaskStatus.COMPLETED;
    }
}
