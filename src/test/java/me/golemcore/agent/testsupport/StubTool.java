package me.golemcore.agent.testsupport;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.RiskLevel;
import me.golemcore.agent.domain.model.SandboxTarget;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Configurable tool that counts its invocations.
 */
public class StubTool implements ToolComponent {

    private final String name;
    private final RiskLevel riskLevel;
    private final Function<Map<String, Object>, CompletableFuture<ToolResult>> behaviour;
    private final AtomicInteger calls = new AtomicInteger();

    private Function<Map<String, Object>, Optional<SandboxTarget>> sandboxTarget = params -> Optional.empty();
    private boolean enabled = true;

    public StubTool(String name, RiskLevel riskLevel,
            Function<Map<String, Object>, CompletableFuture<ToolResult>> behaviour) {
        this.name = name;
        this.riskLevel = riskLevel;
        this.behaviour = behaviour;
    }

    public static StubTool returning(String name, RiskLevel riskLevel, String output) {
        return new StubTool(name, riskLevel, params -> CompletableFuture.completedFuture(ToolResult.success(output)));
    }

    public StubTool withSandboxTarget(Function<Map<String, Object>, Optional<SandboxTarget>> target) {
        this.sandboxTarget = target;
        return this;
    }

    public StubTool disabled() {
        this.enabled = false;
        return this;
    }

    public int getCalls() {
        return calls.get();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple(name, "Stub tool " + name);
    }

    @Override
    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    @Override
    public Optional<SandboxTarget> sandboxTarget(Map<String, Object> parameters) {
        return sandboxTarget.apply(parameters);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        calls.incrementAndGet();
        return behaviour.apply(parameters);
    }
}
