package com.branchwork.config;

import com.branchwork.core.coordinator.EpicCoordinatorConfig;
import com.branchwork.core.security.PermissionLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "branchwork")
public class BranchworkProperties {

    private Coordinator coordinator = new Coordinator();
    private Agents agents = new Agents();

    // -- Agent accessors (delegate to nested) --
    public Duration getHeartbeatTimeout() { return agents.heartbeatTimeout; }
    public int getMaxAgents() { return agents.maxAgents; }

    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Agents getAgents() { return agents; }
    public void setAgents(Agents agents) { this.agents = agents; }

    /**
     * Freezes the coordinator settings into the immutable form the coordinator is built with.
     */
    public EpicCoordinatorConfig toCoordinatorConfig() {
        return new EpicCoordinatorConfig(
                coordinator.branchPrefix,
                coordinator.agentPoolPrefix,
                coordinator.autoCreateBranches,
                coordinator.autoAssignAgents,
                coordinator.maxConcurrentSubTasks,
                coordinator.defaultPermissionLevel,
                coordinator.dataSourceLocation);
    }

    public static class Coordinator {
        private String branchPrefix = "epic";
        private String agentPoolPrefix = "agent";
        private boolean autoCreateBranches = true;
        private boolean autoAssignAgents = true;
        private int maxConcurrentSubTasks = 4;
        private PermissionLevel defaultPermissionLevel = PermissionLevel.SANDBOXED;
        private String dataSourceLocation = ".";

        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public String getAgentPoolPrefix() { return agentPoolPrefix; }
        public void setAgentPoolPrefix(String agentPoolPrefix) { this.agentPoolPrefix = agentPoolPrefix; }
        public boolean isAutoCreateBranches() { return autoCreateBranches; }
        public void setAutoCreateBranches(boolean autoCreateBranches) { this.autoCreateBranches = autoCreateBranches; }
        public boolean isAutoAssignAgents() { return autoAssignAgents; }
        public void setAutoAssignAgents(boolean autoAssignAgents) { this.autoAssignAgents = autoAssignAgents; }
        public int getMaxConcurrentSubTasks() { return maxConcurrentSubTasks; }
        public void setMaxConcurrentSubTasks(int maxConcurrentSubTasks) { this.maxConcurrentSubTasks = maxConcurrentSubTasks; }
        public PermissionLevel getDefaultPermissionLevel() { return defaultPermissionLevel; }
        public void setDefaultPermissionLevel(PermissionLevel defaultPermissionLevel) { this.defaultPermissionLevel = defaultPermissionLevel; }
        public String getDataSourceLocation() { return dataSourceLocation; }
        public void setDataSourceLocation(String dataSourceLocation) { this.dataSourceLocation = dataSourceLocation; }
    }

    public static class Agents {
        private Duration heartbeatTimeout = Duration.ofMinutes(5);
        private int maxAgents = 1000;

        public Duration getHeartbeatTimeout() { return heartbeatTimeout; }
        public void setHeartbeatTimeout(Duration heartbeatTimeout) { this.heartbeatTimeout = heartbeatTimeout; }
        public int getMaxAgents() { return maxAgents; }
        public void setMaxAgents(int maxAgents) { this.maxAgents = maxAgents; }
    }
}
