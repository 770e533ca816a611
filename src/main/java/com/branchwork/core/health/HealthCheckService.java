package com.branchwork.core.health;

import com.branchwork.config.BranchworkProperties;
import com.branchwork.core.agent.Agent;
import com.branchwork.core.agent.AgentRegistry;
import com.branchwork.core.coordinator.EpicCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AgentRegistry agentRegistry;
    private final EpicCoordinator epicCoordinator;
    private final Duration heartbeatTimeout;

    public HealthCheckService(
            @Autowired(required = false) AgentRegistry agentRegistry,
            @Autowired(required = false) EpicCoordinator epicCoordinator,
            @Autowired(required = false) BranchworkProperties properties) {
        this.agentRegistry = agentRegistry;
        this.epicCoordinator = epicCoordinator;
        this.heartbeatTimeout = properties != null ? properties.getHeartbeatTimeout() : Duration.ofMinutes(5);
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkAgents());
        results.add(checkCoordinator());
        return results;
    }

    private HealthStatus checkAgents() {
        if (agentRegistry == null) {
            return HealthStatus.down("agents", "Agent registry not available");
        }
        List<Agent> stale = agentRegistry.staleAgents(heartbeatTimeout);
        int total = agentRegistry.size();
        var metadata = Map.of(
                "registered", String.valueOf(total),
                "available", String.valueOf(agentRegistry.availableAgents(heartbeatTimeout).size()),
                "stale", String.valueOf(stale.size()),
                "heartbeatTimeout", heartbeatTimeout.toString());
        if (stale.isEmpty()) {
            return HealthStatus.up("agents", total + " agent(s) registered, all responsive", metadata);
        }
        String ids = stale.stream().map(Agent::id).limit(5).collect(Collectors.joining(", "));
        log.warn("{} of {} agents missed their heartbeat window ({}): {}", stale.size(), total, heartbeatTimeout, ids);
        return HealthStatus.degraded("agents", stale.size() + " of " + total + " agent(s) stale: " + ids, metadata);
    }

    private HealthStatus checkCoordinator() {
        if (epicCoordinator == null) {
            return HealthStatus.down("coordinator", "Epic coordinator not available");
        }
        int epics = epicCoordinator.listEpics().size();
        int maxConcurrent = epicCoordinator.config().maxConcurrentSubTasks();
        return HealthStatus.up("coordinator",
                epics + " epic(s) registered, max " + maxConcurrent + " concurrent sub-tasks",
                Map.of("epics", String.valueOf(epics), "maxConcurrentSubTasks", String.valueOf(maxConcurrent)));
    }
}
