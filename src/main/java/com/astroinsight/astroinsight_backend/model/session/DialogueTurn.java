package com.astroinsight.astroinsight_backend.model.session;

import java.time.Instant;

public record DialogueTurn(
        int     turn,
        String  userInput,
        String  assistantResponse,
        Instant timestamp
) {}
