package me.golemcore.krishi.domain.service;

import me.golemcore.krishi.domain.component.ToolComponent;
import me.golemcore.krishi.domain.exception.DeadlineExceededException;
import me.golemcore.krishi.domain.exception.NotFoundException;
import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolFailureKind;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.infrastructure.config.KrishiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class AgentToolDispatcherTest {

    private KrishiProperties properties;

    @BeforeEach
    void setUp() {
        properties = new KrishiProperties();
        properties.getTools().setTimeout(Duration.ofMillis(200));
    }

    private AgentToolDispatcher dispatcher(ToolComponent... tools) {
        return new AgentToolDispatcher(List.of(tools), properties);
    }

    private static StubTool tool(String name, Function<Map<String, Object>, CompletableFuture<ToolResult>> body) {
        return new StubTool(name, true, body);
    }

    // ===== registry =====

    @Test
    void shouldListEnabledToolDefinitionsSorted() {
        AgentToolDispatcher dispatcher = dispatcher(
                tool("zeta", args -> null),
                new StubTool("hidden", false, args -> null),
                tool("alpha", args -> null));

        List<String> names = dispatcher.getToolDefinitions().stream().map(ToolDefinition::getName).toList();

        assertEquals(List.of("alpha", "zeta"), names);
        assertEquals(List.of("alpha", "hidden", "zeta"), List.copyOf(dispatcher.getToolNames()));
        assertNotNull(dispatcher.getTool("hidden"));
        assertNull(dispatcher.getTool(null));
    }

    // ===== policy =====

    @Test
    void shouldDenyUnknownTool() {
        AgentToolDispatcher dispatcher = dispatcher(tool("b_tool", args -> null), tool("a_tool", args -> null));

        ToolResult result = dispatcher.execute("missing", Map.of());

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
        assertEquals("Unknown tool: missing. Available tools: a_tool, b_tool", result.getError());
    }

    @Test
    void shouldDenyDisabledTool() {
        AgentToolDispatcher dispatcher = dispatcher(new StubTool("off", false,
                args -> CompletableFuture.completedFuture(ToolResult.success("ran", null))));

        ToolResult result = dispatcher.execute("off", Map.of());

        assertEquals(ToolFailureKind.POLICY_DENIED, result.getFailureKind());
        assertEquals("Tool is disabled: off", result.getError());
    }

    // ===== execution =====

    @Test
    void shouldReturnToolResult() {
        AgentToolDispatcher dispatcher = dispatcher(tool("echo",
                args -> CompletableFuture.completedFuture(ToolResult.success(String.valueOf(args.get("q")), null))));

        ToolResult result = dispatcher.execute("echo", Map.of("q", "hello"));

        assertTrue(result.isSuccess());
        assertEquals("hello", result.getOutput());
    }

    @Test
    void shouldPassEmptyArgumentsForNull() {
        AgentToolDispatcher dispatcher = dispatcher(tool("size",
                args -> CompletableFuture.completedFuture(ToolResult.success(String.valueOf(args.size()), null))));

        assertEquals("0", dispatcher.execute("size", null).getOutput());
    }

    @Test
    void shouldTimeOutAndCancelSlowTool() {
        CompletableFuture<ToolResult> never = new CompletableFuture<>();
        AgentToolDispatcher dispatcher = dispatcher(tool("slow", args -> never));

        ToolResult result = dispatcher.execute("slow", Map.of());

        assertEquals(ToolFailureKind.TIMEOUT, result.getFailureKind());
        assertEquals("Tool slow timed out after 200 ms", result.getError());
        assertTrue(never.isCancelled());
    }

    @Test
    void shouldMapFailedFutures() {
        AgentToolDispatcher dispatcher = dispatcher(
                tool("missing", args -> CompletableFuture.failedFuture(new NotFoundException("No data for crop"))),
                tool("offline", args -> CompletableFuture.failedFuture(new ProviderException("store offline"))),
                tool("deadline", args -> CompletableFuture.failedFuture(new DeadlineExceededException("scan"))),
                tool("broken", args -> CompletableFuture.failedFuture(new IllegalStateException("boom"))));

        ToolResult missing = dispatcher.execute("missing", Map.of());
        ToolResult offline = dispatcher.execute("offline", Map.of());
        ToolResult deadline = dispatcher.execute("deadline", Map.of());
        ToolResult broken = dispatcher.execute("broken", Map.of());

        assertEquals(ToolFailureKind.NOT_FOUND, missing.getFailureKind());
        assertEquals("No data for crop", missing.getError());
        assertEquals(ToolFailureKind.PROVIDER_UNAVAILABLE, offline.getFailureKind());
        assertEquals("Failed to run offline: store offline", offline.getError());
        assertEquals(ToolFailureKind.TIMEOUT, deadline.getFailureKind());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, broken.getFailureKind());
        assertEquals("Failed to run broken: boom", broken.getError());
    }

    @Test
    void shouldMapSynchronousExceptions() {
        AgentToolDispatcher dispatcher = dispatcher(tool("strict", args -> {
            throw new ValidationException("District is required");
        }));

        ToolResult result = dispatcher.execute("strict", Map.of());

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertEquals("District is required", result.getError());
    }

    @Test
    void shouldFailOnNullResult() {
        AgentToolDispatcher dispatcher = dispatcher(tool("empty", args -> CompletableFuture.completedFuture(null)));

        ToolResult result = dispatcher.execute("empty", Map.of());

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
    }

    private static final class StubTool implements ToolComponent {

        private final String name;
        private final boolean enabled;
        private final Function<Map<String, Object>, CompletableFuture<ToolResult>> body;

        StubTool(String name, boolean enabled, Function<Map<String, Object>, CompletableFuture<ToolResult>> body) {
            this.name = name;
            this.enabled = enabled;
            this.body = body;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder().name(name).description(name).inputSchema(Map.of()).build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            return body.apply(parameters);
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }
}
