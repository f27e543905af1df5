package com.loopclaw.agent;

import com.loopclaw.approval.ApprovalStrategy;
import com.loopclaw.events.AgentEventListener;
import com.loopclaw.events.EventDispatcher;
import com.loopclaw.events.LoggingEventListener;
import com.loopclaw.observability.ToolMetricsTracker;
import com.loopclaw.providers.ModelProvider;
import com.loopclaw.shared.config.LoopClawConfig;
import com.loopclaw.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AgentLoopFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentLoopFactory.class);

    private AgentLoopFactory() {}

    public static AgentLoop create(ModelProvider provider, ToolRegistry toolRegistry, LoopClawConfig config,
                                   ApprovalStrategy approvalStrategy, AgentEventListener eventListener) {
        var tracker = new ToolMetricsTracker();
        if (config.metricsFile() != null) {
            tracker.load(config.metricsFile());
            log.info("Loaded {} tool metrics from {}", tracker.totalExecutions(), config.metricsFile());
        }

        var events = new EventDispatcher(new LoggingEventListener());
        if (eventListener != null) events.addListener(eventListener);

        var loop = new AgentLoop(provider, toolRegistry, config.agent(), approvalStrategy, events,
                tracker, new BlockResponseParser(), null);
        if (config.workDir() != null) loop.setWorkDir(config.workDir());
        loop.setDefaultModel(config.model());
        loop.setMetricsFile(config.metricsFile());
        return loop;
    }
}
