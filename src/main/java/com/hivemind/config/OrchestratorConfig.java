package com.hivemind.config;

import com.hivemind.core.engine.Orchestrator;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.execution.SimulatedTaskDispatcher;
import com.hivemind.core.execution.TaskDispatcher;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.pool.AgentPool;
import com.hivemind.core.pool.AgentPoolException;
import com.hivemind.core.pool.SeedAgentLoader;
import com.hivemind.core.registry.TaskRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Random;

@Configuration
@EnableConfigurationProperties(HivemindProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared randomness for drift, spawning and simulation. Seeded when
     * {@code hivemind.simulation.seed} is set so runs can be replayed.
     */
    @Bean
    @ConditionalOnMissingBean
    public Random orchestratorRandom(HivemindProperties properties) {
        Long seed = properties.getSimulation().getSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    @Bean
    public AgentPool agentPool(HivemindProperties properties, ResourceLoader resourceLoader,
                               ObjectMapper objectMapper, Clock clock) {
        String location = properties.getPool().getSeedResource();
        if (location == null || location.isBlank()) {
            log.info("No seed roster configured; starting with an empty agent pool");
            return new AgentPool();
        }
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            var agents = new SeedAgentLoader(objectMapper).load(in, clock.instant());
            log.info("Seeded agent pool with {} agent(s) from {}", agents.size(), location);
            return new AgentPool(agents);
        } catch (IOException e) {
            throw new AgentPoolException("Cannot read seed roster " + location, e);
        }
    }

    @Bean
    public TaskRegistry taskRegistry(Clock clock) {
        return new TaskRegistry(clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(TaskDispatcher.class)
    public SimulatedTaskDispatcher simulatedTaskDispatcher(HivemindProperties properties, Random orchestratorRandom) {
        var simulation = properties.getSimulation();
        return new SimulatedTaskDispatcher(orchestratorRandom, simulation.getMsPerComplexity(),
                simulation.getJitterMs(), simulation.getTimeScale());
    }

    @Bean
    public EventBus eventBus() {
        return new EventBus();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public Orchestrator orchestrator(HivemindProperties properties, AgentPool agentPool, TaskRegistry taskRegistry,
                                     TaskDispatcher dispatcher, EventBus eventBus,
                                     @Autowired(required = false) HivemindMetrics metrics,
                                     Clock clock, Random orchestratorRandom) {
        return new Orchestrator(properties, agentPool, taskRegistry, dispatcher, eventBus, metrics,
                clock, orchestratorRandom);
    }
}
