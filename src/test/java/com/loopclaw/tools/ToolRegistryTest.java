package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopclaw.approval.DangerousOperation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void registersAndLooksUpByName() {
        var registry = new ToolRegistry();
        var tool = new NamedTool("echo");
        registry.register(tool);

        assertSame(tool, registry.get("echo"));
        assertNull(registry.get("missing"));
        assertTrue(registry.contains("echo"));
        assertEquals(1, registry.size());
    }

    @Test
    void rejectsDuplicateNames() {
        var registry = new ToolRegistry();
        registry.register(new NamedTool("echo"));

        var e = assertThrows(IllegalArgumentException.class, () -> registry.register(new NamedTool("echo")));
        assertTrue(e.getMessage().contains("echo"));
    }

    @Test
    void listsInRegistrationOrder() {
        var registry = new ToolRegistry();
        for (var name : List.of("zeta", "alpha", "mid")) registry.register(new NamedTool(name));

        assertEquals(List.of("zeta", "alpha", "mid"), registry.names());
        assertEquals("zeta", registry.listTools().get(0).name());
        assertEquals(List.of("zeta", "alpha", "mid"),
                registry.definitions().stream().map(ToolDefinition::name).toList());
    }

    @Test
    void partitionsBySafety() {
        var registry = new ToolRegistry();
        registry.register(new NamedTool("read"));
        registry.register(new RiskyTool());

        assertEquals(List.of("read"), registry.getSafeTools().stream().map(Tool::name).toList());
        assertEquals(List.of("risky"), registry.getDangerousTools().stream().map(Tool::name).toList());
        assertTrue(registry.get("risky").toolDefinition().dangerous());
    }

    @Test
    void unregisterAndClear() {
        var registry = new ToolRegistry();
        registry.register(new NamedTool("a"));
        registry.register(new NamedTool("b"));

        assertTrue(registry.unregister("a"));
        assertFalse(registry.unregister("a"));
        assertEquals(List.of("b"), registry.names());

        registry.clear();
        assertEquals(0, registry.size());
    }

    @Test
    void toleratesConcurrentLookups() throws Exception {
        var registry = new ToolRegistry();
        for (int i = 0; i < 20; i++) registry.register(new NamedTool("t" + i));
        var pool = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        var found = new AtomicInteger();
        try {
            var futures = new ArrayList<java.util.concurrent.Future<?>>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 1000; n++) {
                        if (registry.get("t" + (n % 20)) != null) found.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (var f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(8000, found.get());
    }

    @Test
    void definitionSchemaIsBackendAgnostic() {
        var schema = new NamedTool("echo").toolDefinition().toSchema();

        assertEquals("echo", schema.get("name"));
        assertEquals("echo tool", schema.get("description"));
        assertEquals("object", ((Map<?, ?>) schema.get("input_schema")).get("type"));
    }

    static class NamedTool implements Tool {
        private final String name;

        NamedTool(String name) { this.name = name; }

        @Override public String name() { return name; }
        @Override public String description() { return name + " tool"; }
        @Override public JsonNode inputSchema() { return MAPPER.createObjectNode().put("type", "object"); }
        @Override public ToolResult execute(ToolContext ctx, JsonNode input) {
            return ToolResult.success(ctx.toolCallId(), name);
        }
    }

    @DangerousOperation(reason = "test")
    static class RiskyTool extends NamedTool {
        RiskyTool() { super("risky"); }
    }
}
