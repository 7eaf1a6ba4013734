package com.hivemind.core.pool;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.CapabilityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the set of agents, in registration order.
 * <p>
 * Not thread-safe on its own: the orchestrator serializes every call under its state lock.
 */
public class AgentPool {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);

    private final Map<String, Agent> agents = new LinkedHashMap<>();

    public AgentPool() {
    }

    public AgentPool(Collection<Agent> initialAgents) {
        initialAgents.forEach(this::register);
    }

    public void register(Agent agent) {
        if (agents.containsKey(agent.id())) {
            throw new DuplicateAgentException(agent.id());
        }
        agents.put(agent.id(), agent);
        log.info("Registered agent {} ({}) with capabilities {}", agent.id(), agent.name(), agent.capabilities());
    }

    public Optional<Agent> get(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Agent require(String agentId) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            throw new UnknownAgentException(agentId);
        }
        return agent;
    }

    /** Live, read-only view in registration order. */
    public Collection<Agent> list() {
        return Collections.unmodifiableCollection(agents.values());
    }

    public List<Agent> snapshot() {
        return agents.values().stream().map(Agent::copy).toList();
    }

    public int size() {
        return agents.size();
    }

    public boolean contains(String agentId) {
        return agents.containsKey(agentId);
    }

    /**
     * Removes an idle agent.
     *
     * @throws AgentBusyException if the agent still holds tasks; the pool is left unchanged
     */
    public Agent remove(String agentId) {
        Agent agent = require(agentId);
        if (!agent.currentTasks().isEmpty()) {
            throw new AgentBusyException(agentId, agent.currentTasks());
        }
        agents.remove(agentId);
        log.info("Removed agent {}", agentId);
        return agent;
    }

    public Agent setStatus(String agentId, AgentStatus status) {
        Agent agent = require(agentId);
        AgentStatus previous = agent.status();
        agent.setStatus(status);
        log.info("Agent {} status {} -> {}", agentId, previous.wireName(), agent.status().wireName());
        return agent;
    }

    /** Fraction of agents that are busy or overloaded; 0 for an empty pool. */
    public double systemLoad() {
        if (agents.isEmpty()) {
            return 0.0;
        }
        long busy = agents.values().stream().filter(Agent::isBusyOrOverloaded).count();
        return (double) busy / agents.size();
    }

    public int totalCapacity() {
        return agents.values().stream().mapToInt(Agent::maxConcurrentTasks).sum();
    }

    public int usedCapacity() {
        return agents.values().stream().mapToInt(a -> a.currentTasks().size()).sum();
    }

    /** First free id of the form {@code <type>-NNN}, starting at 001. */
    public String nextAgentId(CapabilityType type) {
        int n = 1;
        String candidate;
        do {
            candidate = String.format("%s-%03d", type.wireName(), n++);
        } while (agents.containsKey(candidate));
        return candidate;
    }
}
