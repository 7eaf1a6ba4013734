package com.hivemind.core.pool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentPerformance;
import com.hivemind.core.model.Capability;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Location;
import com.hivemind.core.model.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads the initial agent roster from a JSON array.
 * <p>
 * Each element has {@code id}, {@code name}, {@code capabilities[]} (type, level,
 * specializations, resourceCost, maxConcurrentTasks), {@code performance}
 * (successRate, efficiency), {@code resources} (cpu, memory, network),
 * {@code location} (x, y) and {@code connections[]}.
 */
public class SeedAgentLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedAgentLoader.class);

    private final ObjectMapper objectMapper;

    public SeedAgentLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public SeedAgentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param in  JSON array of agent definitions
     * @param now timestamp used as every agent's {@code lastActive}
     * @throws AgentPoolException if the document cannot be parsed or names an unknown capability
     */
    public List<Agent> load(InputStream in, Instant now) {
        List<SeedAgent> seeds;
        try {
            seeds = objectMapper.readValue(in, new TypeReference<List<SeedAgent>>() {});
        } catch (IOException e) {
            throw new AgentPoolException("Failed to read seed agents: " + e.getMessage(), e);
        }
        var agents = new ArrayList<Agent>();
        for (SeedAgent seed : seeds) {
            try {
                agents.add(toAgent(seed, now));
            } catch (IllegalArgumentException e) {
                throw new AgentPoolException("Invalid seed agent " + seed.id() + ": " + e.getMessage(), e);
            }
        }
        log.info("Loaded {} seed agent(s)", agents.size());
        return agents;
    }

    private Agent toAgent(SeedAgent seed, Instant now) {
        var capabilities = new ArrayList<Capability>();
        for (SeedCapability c : seed.capabilities() == null ? List.<SeedCapability>of() : seed.capabilities()) {
            capabilities.add(new Capability(CapabilityType.fromName(c.type()), c.level(),
                    c.specializations() == null ? null : new LinkedHashSet<>(c.specializations()),
                    c.resourceCost(), c.maxConcurrentTasks()));
        }
        SeedPerformance perf = seed.performance() != null ? seed.performance() : new SeedPerformance(1.0, 1.0);
        SeedResources res = seed.resources() != null ? seed.resources() : new SeedResources(0, 0, 0);
        return new Agent(seed.id(), seed.name(), capabilities,
                new AgentPerformance(0, 0, perf.successRate(), perf.efficiency(), now),
                new ResourceUsage(res.cpu(), res.memory(), res.network()),
                seed.location(),
                seed.connections() == null ? null : new LinkedHashSet<>(seed.connections()));
    }

    record SeedAgent(String id, String name, List<SeedCapability> capabilities, SeedPerformance performance,
                     SeedResources resources, Location location, List<String> connections) {}

    record SeedCapability(String type, double level, List<String> specializations, double resourceCost,
                          int maxConcurrentTasks) {}

    record SeedPerformance(double successRate, double efficiency) {}

    record SeedResources(double cpu, double memory, double network) {}
}
