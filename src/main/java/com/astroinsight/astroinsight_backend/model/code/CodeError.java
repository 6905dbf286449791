package com.astroinsight.astroinsight_backend.model.code;

public record CodeError(CodeErrorType type, String code, String message, int attempt) {}
