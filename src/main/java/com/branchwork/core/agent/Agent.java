package com.branchwork.core.agent;

import com.branchwork.core.security.PermissionLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A logical worker identity. Everything except the heartbeat and the running sub-task count is
 * fixed at registration; both are written only by {@link AgentRegistry}.
 */
public final class Agent {

    private final String id;
    private final Set<String> capabilities;
    private final PermissionLevel permissionLevel;
    private final Instant registeredAt;
    private volatile Instant lastHeartbeat;
    private final AtomicInteger runningSubTasks = new AtomicInteger();

    Agent(String id, Set<String> capabilities, PermissionLevel permissionLevel, Instant registeredAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        this.permissionLevel = Objects.requireNonNull(permissionLevel, "permissionLevel");
        this.registeredAt = Objects.requireNonNull(registeredAt, "registeredAt");
        this.lastHeartbeat = registeredAt;
    }

    public String id() {
        return id;
    }

    public Set<String> capabilities() {
        return capabilities;
    }

    public PermissionLevel permissionLevel() {
        return permissionLevel;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    boolean isAliveAt(Instant now, Duration timeout) {
        return Duration.between(lastHeartbeat, now).compareTo(timeout) <= 0;
    }

    public int runningSubTasks() {
        return runningSubTasks.get();
    }

    AgentStatus statusAt(Instant now, Duration timeout) {
        if (!isAliveAt(now, timeout)) {
            return AgentStatus.OFFLINE;
        }
        return runningSubTasks.get() > 0 ? AgentStatus.BUSY : AgentStatus.AVAILABLE;
    }

    void startSubTask() {
        runningSubTasks.incrementAndGet();
    }

    void finishSubTask() {
        runningSubTasks.updateAndGet(n -> n > 0 ? n - 1 : 0);
    }

    void recordHeartbeat(Instant at) {
        this.lastHeartbeat = at;
    }

    @Override
    public String toString() {
        return "Agent[" + id + ", " + permissionLevel + ", capabilities=" + capabilities
                + ", running=" + runningSubTasks.get() + ", lastHeartbeat=" + lastHeartbeat + "]";
    }
}
