package com.loopclaw.providers;

import java.util.concurrent.CompletableFuture;

/**
 * Completion backend. Model selection, retries and provider fallback live
 * behind this interface; the agent loop only bounds each call with a deadline
 * and cancels the returned future when it expires.
 */
public interface ModelProvider {
    String id();
    CompletableFuture<ChatResponse> complete(ChatRequest request);
}
