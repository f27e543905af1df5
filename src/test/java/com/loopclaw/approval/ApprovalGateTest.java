package com.loopclaw.approval;

import com.fasterxml.jackson.databind.JsonNode;
import com.loopclaw.events.AgentEvent;
import com.loopclaw.events.EventDispatcher;
import com.loopclaw.events.EventType;
import com.loopclaw.shared.config.RunConfig;
import com.loopclaw.tools.Tool;
import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolContext;
import com.loopclaw.tools.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalGateTest {

    @DangerousOperation(reason = "test")
    static class DangerousTool implements Tool {
        @Override public String name() { return "dangerous"; }
        @Override public String description() { return ""; }
        @Override public JsonNode inputSchema() { return null; }
        @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return null; }
    }

    static class SafeTool implements Tool {
        @Override public String name() { return "safe"; }
        @Override public String description() { return ""; }
        @Override public JsonNode inputSchema() { return null; }
        @Override public ToolResult execute(ToolContext ctx, JsonNode input) { return null; }
    }

    private final List<AgentEvent> events = new ArrayList<>();

    @Test
    void autoModeAllowsDangerousTools() {
        var gate = gate(RunConfig.defaults().withApprovalMode(ApprovalMode.AUTO), null);
        assertTrue(gate.check(call("dangerous"), new DangerousTool(), 1).allowed());
        assertTrue(events.isEmpty());
    }

    @Test
    void manualModeAllowsSafeToolWithoutAsking() {
        var gate = gate(RunConfig.defaults(), (c, d) -> fail("should not ask"));
        assertTrue(gate.check(call("safe"), new SafeTool(), 1).allowed());
    }

    @Test
    void manualModeDeniesDangerousToolWithoutHandler() {
        var gate = gate(RunConfig.defaults(), null);

        var decision = gate.check(call("dangerous"), new DangerousTool(), 1);

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("no handler"));
        assertEquals(List.of(EventType.TOOL_APPROVAL_NEEDED, EventType.TOOL_DENIED), types());
    }

    @Test
    void manualModeAsksHandler() {
        var asked = new ArrayList<String>();
        var gate = gate(RunConfig.defaults(), (c, d) -> {
            asked.add(d.name());
            return true;
        });

        assertTrue(gate.check(call("dangerous"), new DangerousTool(), 2).allowed());
        assertEquals(List.of("dangerous"), asked);
        assertEquals(List.of(EventType.TOOL_APPROVAL_NEEDED, EventType.TOOL_APPROVED), types());
        assertEquals(2, events.get(0).iteration());
    }

    @Test
    void handlerRefusalAndFailureBothDeny() {
        var refusing = gate(RunConfig.defaults(), (c, d) -> false);
        assertFalse(refusing.check(call("dangerous"), new DangerousTool(), 1).allowed());

        var failing = gate(RunConfig.defaults(), (c, d) -> {
            throw new IllegalStateException("prompt closed");
        });
        assertFalse(failing.check(call("dangerous"), new DangerousTool(), 1).allowed());
    }

    @Test
    void blockListWinsOverEverything() {
        var config = RunConfig.defaults()
                .withApprovalMode(ApprovalMode.AUTO)
                .withAllowedTools(Set.of("safe"))
                .withBlockedTools(Set.of("safe"));
        var gate = gate(config, null);

        var decision = gate.check(call("safe"), new SafeTool(), 1);

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("blocked"));
        assertEquals(List.of(EventType.TOOL_ERROR), types());
        assertFalse(gate.isAdvertised(new SafeTool()));
    }

    @Test
    void allowListExcludesOtherTools() {
        var gate = gate(RunConfig.defaults().withAllowedTools(Set.of("safe")), null);

        var decision = gate.check(call("dangerous"), new DangerousTool(), 1);

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("not in allowed list"));
        assertTrue(gate.isAdvertised(new SafeTool()));
        assertFalse(gate.isAdvertised(new DangerousTool()));
    }

    @Test
    void disabledModeDeniesAndHidesEverything() {
        var gate = gate(RunConfig.defaults().withApprovalMode(ApprovalMode.DISABLED), (c, d) -> true);

        assertFalse(gate.check(call("safe"), new SafeTool(), 1).allowed());
        assertFalse(gate.isAdvertised(new SafeTool()));

        var off = gate(RunConfig.defaults().withApprovalMode(ApprovalMode.AUTO).withEnableTools(false), null);
        assertFalse(off.check(call("safe"), new SafeTool(), 1).allowed());
    }

    @Test
    void manualModeStillAdvertisesDangerousTools() {
        assertTrue(gate(RunConfig.defaults(), null).isAdvertised(new DangerousTool()));
    }

    @Test
    void asyncStrategyAdaptsToBlocking() {
        AsyncApprovalStrategy yes = (c, d) -> CompletableFuture.completedFuture(true);
        AsyncApprovalStrategy broken = (c, d) -> CompletableFuture.failedFuture(new IllegalStateException("gone"));
        AsyncApprovalStrategy unanswered = (c, d) -> CompletableFuture.completedFuture(null);

        assertTrue(gate(RunConfig.defaults(), yes.blocking()).check(call("dangerous"), new DangerousTool(), 1).allowed());
        assertFalse(gate(RunConfig.defaults(), broken.blocking()).check(call("dangerous"), new DangerousTool(), 1).allowed());
        assertFalse(gate(RunConfig.defaults(), unanswered.blocking()).check(call("dangerous"), new DangerousTool(), 1).allowed());
    }

    @Test
    void parsesApprovalModes() {
        assertEquals(ApprovalMode.MANUAL, ApprovalMode.fromString(" Manual "));
        assertEquals(ApprovalMode.AUTO, ApprovalMode.fromString("auto"));
        assertThrows(IllegalArgumentException.class, () -> ApprovalMode.fromString("sometimes"));
    }

    private ApprovalGate gate(RunConfig config, ApprovalStrategy strategy) {
        return new ApprovalGate(config, strategy, new EventDispatcher(events::add));
    }

    private List<EventType> types() {
        return events.stream().map(AgentEvent::type).toList();
    }

    private static ToolCall call(String name) {
        return new ToolCall("call-" + name, name, null);
    }
}
