package com.branchwork.core.agent;

import com.branchwork.core.events.EventBus;
import com.branchwork.core.events.OrchestrationEvent;
import com.branchwork.core.result.ErrorCode;
import com.branchwork.core.result.Result;
import com.branchwork.core.security.OperationKind;
import com.branchwork.core.security.PermissionGuard;
import com.branchwork.core.security.PermissionLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of logical agents and their liveness.
 * <p>
 * Backed by a {@link ConcurrentHashMap}; registrations and heartbeats for different agents never
 * contend, and a heartbeat is a single volatile write on the agent. {@code maxAgents} is enforced
 * by reserving a slot before the insert, so concurrent registrations cannot overshoot it.
 * <p>
 * Availability combines liveness with the number of sub-tasks an agent is running: see
 * {@link AgentStatus}.
 */
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentHashMap<String, Agent> agents = new ConcurrentHashMap<>();
    private final AtomicInteger slots = new AtomicInteger();
    private final PermissionGuard permissionGuard;
    private final EventBus eventBus;
    private final Clock clock;
    private final int maxAgents;

    public AgentRegistry(PermissionGuard permissionGuard, EventBus eventBus, Clock clock, int maxAgents) {
        this.permissionGuard = permissionGuard;
        this.eventBus = eventBus;
        this.clock = clock;
        this.maxAgents = maxAgents;
    }

    public AgentRegistry(PermissionGuard permissionGuard, Clock clock) {
        this(permissionGuard, new EventBus(), clock, Integer.MAX_VALUE);
    }

    /**
     * Registers a new agent.
     *
     * @return the agent, or {@code DUPLICATE_AGENT} / {@code AGENT_LIMIT_REACHED}
     */
    public Result<Agent> register(String agentId, Set<String> capabilities, PermissionLevel level) {
        if (agentId == null || agentId.isBlank()) {
            return Result.failure(ErrorCode.INVALID_ARGUMENT, "Agent id cannot be blank");
        }
        if (agents.containsKey(agentId)) {
            return Result.failure(ErrorCode.DUPLICATE_AGENT, "Agent " + agentId + " is already registered");
        }
        if (!reserveSlot()) {
            return Result.failure(ErrorCode.AGENT_LIMIT_REACHED,
                    "Maximum number of agents (" + maxAgents + ") reached");
        }
        var candidate = new Agent(agentId, capabilities, level, clock.instant());
        Agent existing = agents.putIfAbsent(agentId, candidate);
        if (existing != null) {
            slots.decrementAndGet();
            return Result.failure(ErrorCode.DUPLICATE_AGENT, "Agent " + agentId + " is already registered");
        }
        onRegistered(candidate);
        return Result.success(candidate);
    }

    /**
     * Returns the agent with {@code agentId}, registering it with the given defaults on first use.
     * Existing agents keep their original capabilities and level. Ignores {@code maxAgents}.
     */
    public Agent getOrCreate(String agentId, Set<String> defaultCapabilities, PermissionLevel defaultLevel) {
        Agent existing = agents.get(agentId);
        if (existing != null) {
            return existing;
        }
        var created = new boolean[1];
        Agent agent = agents.computeIfAbsent(agentId, id -> {
            created[0] = true;
            slots.incrementAndGet();
            return new Agent(id, defaultCapabilities, defaultLevel, clock.instant());
        });
        if (created[0]) {
            onRegistered(agent);
        }
        return agent;
    }

    public Result<Void> heartbeat(String agentId) {
        Agent agent = agentId == null ? null : agents.get(agentId);
        if (agent == null) {
            return Result.failure(ErrorCode.UNKNOWN_AGENT, "Agent " + agentId + " is not registered");
        }
        agent.recordHeartbeat(clock.instant());
        log.trace("Heartbeat from agent {}", agentId);
        return Result.ok();
    }

    /**
     * True when the agent's last heartbeat (or registration) is no older than {@code livenessTimeout}.
     * Unknown agents are never healthy.
     */
    public boolean isHealthy(String agentId, Duration livenessTimeout) {
        Agent agent = agentId == null ? null : agents.get(agentId);
        return agent != null && agent.isAliveAt(clock.instant(), livenessTimeout);
    }

    /**
     * Checks the given operations against the agent's permission level.
     */
    public Result<Void> authorize(String agentId, Collection<OperationKind> operations) {
        Agent agent = agentId == null ? null : agents.get(agentId);
        if (agent == null) {
            return Result.failure(ErrorCode.UNKNOWN_AGENT, "Agent " + agentId + " is not registered");
        }
        return permissionGuard.authorize(agent.permissionLevel(), operations)
                .ifFailure(error -> log.warn("Agent {} denied: {}", agentId, error.message()));
    }

    /**
     * Marks the agent as running one more sub-task. Calls nest; each needs a matching
     * {@link #markAvailable}.
     */
    public Result<Void> markBusy(String agentId) {
        Agent agent = agentId == null ? null : agents.get(agentId);
        if (agent == null) {
            return Result.failure(ErrorCode.UNKNOWN_AGENT, "Agent " + agentId + " is not registered");
        }
        agent.startSubTask();
        log.debug("Agent {} busy ({} running)", agentId, agent.runningSubTasks());
        return Result.ok();
    }

    public Result<Void> markAvailable(String agentId) {
        Agent agent = agentId == null ? null : agents.get(agentId);
        if (agent == null) {
            return Result.failure(ErrorCode.UNKNOWN_AGENT, "Agent " + agentId + " is not registered");
        }
        agent.finishSubTask();
        log.debug("Agent {} released ({} running)", agentId, agent.runningSubTasks());
        return Result.ok();
    }

    /**
     * Current status of the agent, empty for an unknown agent.
     */
    public Optional<AgentStatus> status(String agentId, Duration livenessTimeout) {
        return find(agentId).map(agent -> agent.statusAt(clock.instant(), livenessTimeout));
    }

    public boolean isAvailable(String agentId, Duration livenessTimeout) {
        return status(agentId, livenessTimeout).filter(AgentStatus.AVAILABLE::equals).isPresent();
    }

    /**
     * Alive agents with no running sub-task, oldest registration first.
     */
    public List<Agent> availableAgents(Duration livenessTimeout) {
        Instant now = clock.instant();
        return listAgents().stream()
                .filter(agent -> agent.statusAt(now, livenessTimeout) == AgentStatus.AVAILABLE)
                .toList();
    }

    /**
     * First available agent that declares {@code capability}.
     */
    public Optional<Agent> findByCapability(String capability, Duration livenessTimeout) {
        if (capability == null) {
            return Optional.empty();
        }
        return availableAgents(livenessTimeout).stream()
                .filter(agent -> agent.hasCapability(capability))
                .findFirst();
    }

    public Optional<Agent> find(String agentId) {
        return Optional.ofNullable(agentId == null ? null : agents.get(agentId));
    }

    public List<Agent> listAgents() {
        return agents.values().stream()
                .sorted(Comparator.comparing(Agent::registeredAt).thenComparing(Agent::id))
                .toList();
    }

    public List<Agent> staleAgents(Duration livenessTimeout) {
        Instant now = clock.instant();
        return listAgents().stream()
                .filter(agent -> !agent.isAliveAt(now, livenessTimeout))
                .toList();
    }

    public boolean unregister(String agentId) {
        boolean removed = agentId != null && agents.remove(agentId) != null;
        if (removed) {
            slots.decrementAndGet();
            log.info("Unregistered agent {}", agentId);
        }
        return removed;
    }

    public int size() {
        return agents.size();
    }

    private boolean reserveSlot() {
        while (true) {
            int taken = slots.get();
            if (taken >= maxAgents) {
                return false;
            }
            if (slots.compareAndSet(taken, taken + 1)) {
                return true;
            }
        }
    }

    private void onRegistered(Agent agent) {
        log.info("Registered agent {} [{}] capabilities={}", agent.id(), agent.permissionLevel(),
                agent.capabilities());
        eventBus.publish(new OrchestrationEvent("agent.registered", null, null,
                Map.of("agentId", agent.id(), "permissionLevel", agent.permissionLevel().name()),
                agent.registeredAt()));
    }
}
