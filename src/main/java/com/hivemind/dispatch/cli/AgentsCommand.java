package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.Orchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hivemind agents
 * <p>
 * Lists the agent pool with status, load, performance and capability levels.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List the agent pool")
@Component
public class AgentsCommand implements Runnable {

    private final Orchestrator orchestrator;

    public AgentsCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var agents = orchestrator.getAgents();
        if (agents.isEmpty()) {
            ConsoleOutput.info("Agent pool is empty");
            return;
        }

        System.out.printf("  %-16s %-22s %-11s %-5s %s%n", "AGENT", "NAME", "STATUS", "LOAD", "CAPABILITIES");
        System.out.println("  " + "-".repeat(90));
        agents.forEach(ConsoleOutput::agentRow);
        System.out.println();
        ConsoleOutput.info(agents.size() + " agent(s), system load "
                + String.format("%.2f", orchestrator.getMetrics().systemLoad()));
    }
}
