package io.switchback.core.backend;

public enum BackendKind {
    LOCAL,
    OPENAI,
    GEMINI,
    CLAUDE
}
