package com.hybridrag.rerank;

import java.io.IOException;

public class JudgeRateLimitedException extends IOException {
    public JudgeRateLimitedException(String message) {
        super(message);
    }
}
