package com.loopclaw.approval;

import com.loopclaw.events.AgentEvent;
import com.loopclaw.events.EventDispatcher;
import com.loopclaw.events.EventType;
import com.loopclaw.shared.config.RunConfig;
import com.loopclaw.tools.Tool;
import com.loopclaw.tools.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Decides whether a tool call runs. Rules, first match wins:
 * <ol>
 *   <li>blocked tool: deny</li>
 *   <li>allow-list present and tool not on it: deny</li>
 *   <li>tools disabled: deny</li>
 *   <li>{@link ApprovalMode#AUTO}: allow</li>
 *   <li>{@link ApprovalMode#MANUAL} and dangerous: ask the {@link ApprovalStrategy}</li>
 *   <li>otherwise: allow</li>
 * </ol>
 */
public class ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final RunConfig config;
    private final ApprovalStrategy strategy;
    private final EventDispatcher events;

    public ApprovalGate(RunConfig config, ApprovalStrategy strategy, EventDispatcher events) {
        this.config = config;
        this.strategy = strategy;
        this.events = events != null ? events : new EventDispatcher();
    }

    /**
     * Whether the tool's definition is sent to the model. Dangerous tools stay
     * visible in manual mode; approval happens when they are called.
     */
    public boolean isAdvertised(Tool tool) {
        return !config.toolsDisabled() && policyDenial(tool.name()) == null;
    }

    public ApprovalDecision check(ToolCall call, Tool tool, int iteration) {
        var denial = policyDenial(tool.name());
        if (denial == null && config.toolsDisabled()) {
            denial = config.enableTools() ? "Tool approval mode is disabled" : "Tool use is disabled";
        }
        if (denial != null) {
            log.warn("Tool not allowed: {} - {}", tool.name(), denial);
            events.emit(AgentEvent.forTool(EventType.TOOL_ERROR, iteration, call, "Tool not allowed: " + denial));
            return ApprovalDecision.deny(denial);
        }
        if (config.approvalMode() == ApprovalMode.AUTO || !tool.isDangerous()) {
            return ApprovalDecision.allow();
        }
        return askApproval(call, tool, iteration);
    }

    private ApprovalDecision askApproval(ToolCall call, Tool tool, int iteration) {
        events.emit(AgentEvent.forTool(EventType.TOOL_APPROVAL_NEEDED, iteration, call,
                "Approval required for tool: " + tool.name(), Map.of("tool_input", call.input())));

        if (strategy == null) {
            log.warn("Manual approval required but no handler: {}", tool.name());
            return denied(call, iteration, "Manual approval required for '" + tool.name() + "', no handler");
        }

        boolean approved;
        try {
            approved = strategy.approve(call, tool.toolDefinition());
        } catch (RuntimeException e) {
            log.warn("Approval handler failed for {}: {}", tool.name(), e.getMessage());
            approved = false;
        }
        if (!approved) {
            log.info("Tool execution denied by user: {}", tool.name());
            return denied(call, iteration, "Tool execution denied by user");
        }
        events.emit(AgentEvent.forTool(EventType.TOOL_APPROVED, iteration, call,
                "Tool execution approved: " + tool.name()));
        return ApprovalDecision.allow();
    }

    private ApprovalDecision denied(ToolCall call, int iteration, String reason) {
        events.emit(AgentEvent.forTool(EventType.TOOL_DENIED, iteration, call,
                "Tool execution denied: " + call.name(), Map.of("reason", reason)));
        return ApprovalDecision.deny(reason);
    }

    private String policyDenial(String toolName) {
        if (config.blockedTools().contains(toolName)) {
            return "Tool '" + toolName + "' is blocked";
        }
        if (!config.allowedTools().isEmpty() && !config.allowedTools().contains(toolName)) {
            return "Tool '" + toolName + "' not in allowed list";
        }
        return null;
    }
}
