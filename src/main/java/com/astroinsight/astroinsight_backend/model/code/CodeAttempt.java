package com.astroinsight.astroinsight_backend.model.code;

public record CodeAttempt(String code, int attemptNumber) {}
