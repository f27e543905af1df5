package com.loopclaw.agent;

import com.loopclaw.approval.ApprovalGate;
import com.loopclaw.approval.ApprovalStrategy;
import com.loopclaw.events.AgentEvent;
import com.loopclaw.events.AgentEventListener;
import com.loopclaw.events.EventDispatcher;
import com.loopclaw.events.EventType;
import com.loopclaw.observability.ToolMetrics;
import com.loopclaw.observability.ToolMetricsTracker;
import com.loopclaw.providers.ChatRequest;
import com.loopclaw.providers.ChatResponse;
import com.loopclaw.providers.ModelProvider;
import com.loopclaw.shared.config.RunConfig;
import com.loopclaw.tools.Tool;
import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolContext;
import com.loopclaw.tools.ToolDefinition;
import com.loopclaw.tools.ToolRegistry;
import com.loopclaw.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Alternates between asking the model for a completion and running the tool
 * calls it proposes, until the model answers without tools, the iteration
 * budget runs out, a completion misses its deadline, or something unexpected
 * fails.
 * <p>
 * Tool calls from one turn run concurrently; their results come back in call
 * order. A failing, unknown or denied tool only produces an error result for
 * the model to read. {@link #run} never throws: terminal failures are reported
 * through {@link AgentResult#stoppedReason()} and {@link AgentResult#error()}.
 * <p>
 * The conversation is only touched by the thread running the loop, between
 * completions. The registry, the metrics sink and the event dispatcher are
 * shared by tool tasks.
 */
public class AgentLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentLoop.class);
    private static final int OUTPUT_PREVIEW_CHARS = 100;

    private final ModelProvider provider;
    private final ToolRegistry toolRegistry;
    private final RunConfig config;
    private final ApprovalGate approvalGate;
    private final EventDispatcher events;
    private final ToolMetrics metrics;
    private final ResponseParser parser;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private String workDir = System.getProperty("user.dir");
    private String defaultModel;
    private Path metricsFile;

    public AgentLoop(ModelProvider provider, ToolRegistry toolRegistry, RunConfig config) {
        this(provider, toolRegistry, config, null, (AgentEventListener) null);
    }

    public AgentLoop(ModelProvider provider, ToolRegistry toolRegistry, RunConfig config,
                     ApprovalStrategy approvalStrategy, AgentEventListener eventListener) {
        this(provider, toolRegistry, config, approvalStrategy, new EventDispatcher(eventListener),
                ToolMetrics.NOOP, new BlockResponseParser(), null);
    }

    /**
     * @param executor runs completions and tool calls; null creates a private
     *                 cached pool that {@link #close()} shuts down. A caller-supplied
     *                 pool must allow at least as many threads as tool calls per turn.
     */
    public AgentLoop(ModelProvider provider, ToolRegistry toolRegistry, RunConfig config,
                     ApprovalStrategy approvalStrategy, EventDispatcher events, ToolMetrics metrics,
                     ResponseParser parser, ExecutorService executor) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry");
        this.config = config != null ? config : RunConfig.defaults();
        this.events = events != null ? events : new EventDispatcher();
        this.metrics = metrics != null ? metrics : ToolMetrics.NOOP;
        this.parser = parser != null ? parser : new BlockResponseParser();
        this.approvalGate = new ApprovalGate(this.config, approvalStrategy, this.events);
        this.ownsExecutor = executor == null;
        this.executor = executor != null ? executor : Executors.newCachedThreadPool(workerThreads());
    }

    public void setWorkDir(String workDir) {
        this.workDir = Objects.requireNonNull(workDir, "workDir");
    }

    public RunConfig config() { return config; }

    public EventDispatcher events() { return events; }

    public void setDefaultModel(String model) {
        this.defaultModel = model;
    }

    public void setMetricsFile(Path metricsFile) {
        this.metricsFile = metricsFile;
    }

    public AgentResult run(List<Map<String, Object>> messages) {
        return run(messages, defaultModel);
    }

    public CompletableFuture<AgentResult> runAsync(List<Map<String, Object>> messages, String model) {
        return CompletableFuture.supplyAsync(() -> run(messages, model), executor);
    }

    public AgentResult run(List<Map<String, Object>> messages, String model) {
        log.info("Starting agent loop (max {} iterations, approval={})",
                config.maxIterations(), config.approvalMode().value());
        int iteration = 0;
        var allCalls = new ArrayList<ToolCall>();
        var allResults = new ArrayList<ToolResult>();
        var conversation = new ArrayList<Map<String, Object>>();

        try {
            conversation.addAll(messages);
            while (iteration < config.maxIterations()) {
                iteration++;
                log.info("Agent iteration {}/{}", iteration, config.maxIterations());
                events.emit(AgentEvent.of(EventType.ITERATION_START, iteration,
                        "Starting iteration " + iteration + "/" + config.maxIterations()));

                var request = new ChatRequest(model, conversation, advertisedTools());
                ChatResponse response;
                try {
                    response = awaitCompletion(request);
                } catch (TimeoutException e) {
                    log.error("Iteration {} timed out after {} ms", iteration, config.timeoutPerIteration().toMillis());
                    return AgentResult.stopped(StopReason.TIMEOUT,
                            "Iteration timeout after " + config.timeoutPerIteration().toMillis() + " ms",
                            iteration, allCalls, allResults, conversation);
                }

                conversation.add(parser.assistantTurn(response));
                events.emit(AgentEvent.of(EventType.AI_RESPONSE, iteration, "AI response received"));

                var flagged = parser.hasToolCalls(response);
                var toolCalls = flagged ? parser.parseResponse(response) : List.<ToolCall>of();
                if (toolCalls.isEmpty()) {
                    if (flagged) {
                        log.warn("Response indicated tool use but none found");
                    }
                    return complete(response, iteration, allCalls, allResults, conversation);
                }

                log.info("AI requested {} tool calls", toolCalls.size());
                var results = executeToolCalls(toolCalls, iteration);
                allCalls.addAll(toolCalls);
                allResults.addAll(results);
                for (var result : results) {
                    conversation.add(parser.toolResultTurn(result));
                }

                long succeeded = results.stream().filter(r -> !r.isError()).count();
                events.emit(AgentEvent.of(EventType.ITERATION_END, iteration, "Iteration " + iteration + " completed",
                        Map.of("tools_executed", toolCalls.size(), "tools_succeeded", (int) succeeded)));
            }

            log.warn("Agent stopped: max iterations ({}) reached", config.maxIterations());
            return AgentResult.stopped(StopReason.MAX_ITERATIONS,
                    "Maximum iterations (" + config.maxIterations() + ") reached",
                    iteration, allCalls, allResults, conversation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Agent loop interrupted at iteration {}", iteration);
            return AgentResult.stopped(StopReason.ERROR, "Interrupted", iteration, allCalls, allResults, conversation);
        } catch (Exception e) {
            var cause = unwrap(e);
            log.error("Agent loop error: {}", cause.getMessage(), cause);
            return AgentResult.stopped(StopReason.ERROR, describe(cause), iteration, allCalls, allResults, conversation);
        }
    }

    private AgentResult complete(ChatResponse response, int iteration, List<ToolCall> calls,
                                 List<ToolResult> results, List<Map<String, Object>> conversation) {
        var finalText = parser.extractTextContent(response);
        log.info("Agent completed after {} iterations", iteration);
        events.emit(AgentEvent.of(EventType.AGENT_COMPLETE, iteration,
                "Agent completed after " + iteration + " iterations", Map.of("final_response", finalText)));
        return AgentResult.completed(finalText, iteration, calls, results, conversation);
    }

    List<ToolDefinition> advertisedTools() {
        if (config.toolsDisabled()) {
            return List.of();
        }
        return toolRegistry.listTools().stream()
                .filter(approvalGate::isAdvertised)
                .map(Tool::toolDefinition)
                .toList();
    }

    private ChatResponse awaitCompletion(ChatRequest request)
            throws InterruptedException, ExecutionException, TimeoutException {
        var pending = new AtomicReference<CompletableFuture<ChatResponse>>();
        var abandoned = new AtomicBoolean();
        var future = CompletableFuture
                .supplyAsync(() -> {
                    var inner = provider.complete(request);
                    pending.set(inner);
                    // deadline may have passed while complete() was still running
                    if (abandoned.get() && inner != null) inner.cancel(true);
                    return inner;
                }, executor)
                .thenCompose(inner -> inner);
        try {
            var response = future.get(config.timeoutPerIteration().toNanos(), TimeUnit.NANOSECONDS);
            if (response == null) {
                throw new IllegalStateException("Provider " + provider.id() + " returned no response");
            }
            return response;
        } catch (TimeoutException | InterruptedException e) {
            abandoned.set(true);
            future.cancel(true);
            var inner = pending.get();
            if (inner != null) inner.cancel(true);
            throw e;
        }
    }

    private List<ToolResult> executeToolCalls(List<ToolCall> calls, int iteration) {
        var futures = new ArrayList<CompletableFuture<ToolResult>>(calls.size());
        for (var call : calls) {
            futures.add(CompletableFuture
                    .supplyAsync(() -> executeSingleTool(call, iteration), executor)
                    .exceptionally(e -> {
                        log.error("Tool task failed: {}", call.name(), e);
                        return ToolResult.failure(call.id(), "Tool execution failed: " + describe(unwrap(e)));
                    }));
        }
        var results = new ArrayList<ToolResult>(calls.size());
        for (var f : futures) {
            results.add(f.join());
        }
        return results;
    }

    ToolResult executeSingleTool(ToolCall call, int iteration) {
        var tool = toolRegistry.get(call.name());
        if (tool == null) {
            log.warn("Tool not found: {}", call.name());
            var message = "Tool '" + call.name() + "' not found";
            events.emit(AgentEvent.forTool(EventType.TOOL_ERROR, iteration, call, message));
            return ToolResult.failure(call.id(), message);
        }

        var decision = approvalGate.check(call, tool, iteration);
        if (!decision.allowed()) {
            return ToolResult.failure(call.id(), decision.reason());
        }

        events.emit(AgentEvent.forTool(EventType.TOOL_START, iteration, call,
                "Executing tool: " + tool.name(), Map.of("tool_input", call.input())));
        log.info("Executing tool: {}", tool.name());
        long start = System.nanoTime();

        try {
            var result = bindToCall(call, tool.execute(new ToolContext(call.id(), workDir), call.input()));
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            recordMetrics(tool.name(), !result.isError(), elapsed, result.isError() ? result.error() : null);

            var data = new LinkedHashMap<String, Object>();
            data.put("execution_time", seconds(elapsed));
            if (result.isError()) {
                data.put("error", result.error());
                events.emit(AgentEvent.forTool(EventType.TOOL_ERROR, iteration, call,
                        "Tool failed: " + tool.name(), data));
            } else {
                data.put("output_preview", preview(result.output()));
                events.emit(AgentEvent.forTool(EventType.TOOL_COMPLETE, iteration, call,
                        "Tool completed: " + tool.name(), data));
            }
            return result;
        } catch (Exception e) {
            var elapsed = Duration.ofNanos(System.nanoTime() - start);
            log.error("Tool execution failed: {}", tool.name(), e);
            recordMetrics(tool.name(), false, elapsed, describe(e));

            var data = new LinkedHashMap<String, Object>();
            data.put("exception", describe(e));
            data.put("execution_time", seconds(elapsed));
            events.emit(AgentEvent.forTool(EventType.TOOL_ERROR, iteration, call,
                    "Tool exception: " + tool.name(), data));
            return ToolResult.failure(call.id(), "Tool execution failed: " + describe(e));
        }
    }

    // results must carry the id of the call that produced them
    private static ToolResult bindToCall(ToolCall call, ToolResult result) {
        if (result == null) {
            return ToolResult.failure(call.id(), "Tool '" + call.name() + "' returned no result");
        }
        if (call.id().equals(result.toolCallId())) {
            return result;
        }
        return new ToolResult(call.id(), result.output(), result.error(), result.isError(), result.exitCode());
    }

    private void recordMetrics(String toolName, boolean success, Duration elapsed, String error) {
        try {
            metrics.record(toolName, success, elapsed, error);
        } catch (RuntimeException e) {
            log.warn("Failed to record metrics for {}: {}", toolName, e.getMessage());
        }
    }

    private static String preview(String output) {
        return output.length() > OUTPUT_PREVIEW_CHARS ? output.substring(0, OUTPUT_PREVIEW_CHARS) : output;
    }

    private static double seconds(Duration d) {
        return d.toNanos() / 1_000_000_000.0;
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "loopclaw-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        try {
            if (metricsFile != null && metrics instanceof ToolMetricsTracker tracker) {
                tracker.save(metricsFile);
                log.info("Saved {} tool metrics to {}", tracker.totalExecutions(), metricsFile);
            }
        } finally {
            if (ownsExecutor) {
                executor.shutdownNow();
            }
        }
    }
}
