package com.branchwork.config;

import com.branchwork.core.agent.AgentRegistry;
import com.branchwork.core.coordinator.EpicCoordinator;
import com.branchwork.core.events.EventBus;
import com.branchwork.core.metrics.BranchworkMetrics;
import com.branchwork.core.security.PermissionGuard;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class BranchworkConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentRegistry agentRegistry(PermissionGuard permissionGuard,
                                       EventBus eventBus,
                                       Clock clock,
                                       BranchworkProperties properties) {
        return new AgentRegistry(permissionGuard, eventBus, clock, properties.getMaxAgents());
    }

    /**
     * The coordinator owns a worker pool; Spring closes it on context shutdown.
     */
    @Bean(destroyMethod = "close")
    public EpicCoordinator epicCoordinator(AgentRegistry agentRegistry,
                                           BranchworkProperties properties,
                                           EventBus eventBus,
                                           @Autowired(required = false) BranchworkMetrics metrics,
                                           Clock clock) {
        return new EpicCoordinator(agentRegistry, properties.toCoordinatorConfig(), eventBus, metrics, clock);
    }
}
