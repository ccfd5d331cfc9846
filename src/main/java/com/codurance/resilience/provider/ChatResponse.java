package com.codurance.resilience.provider;

public final class ChatResponse {
    private final String content;
    private final String model;
    private final String finishReason;

    public ChatResponse(String content, String model, String finishReason) {
        this.content = content;
        this.model = model;
        this.finishReason = finishReason;
    }

    public String getContent() { return content; }
    public String getModel() { return model; }

    /** "stop", "length" or "error". */
    public String getFinishReason() { return finishReason; }
}
