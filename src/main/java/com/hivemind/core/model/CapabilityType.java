package com.hivemind.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of work an agent can be proficient in. Each type carries the
 * specializations a freshly spawned agent of that type starts with.
 */
public enum CapabilityType {
    NLP("sentiment", "entity-extraction", "summarization"),
    QUANTUM("optimization", "cryptography", "simulation"),
    SWARM("coordination", "consensus", "distributed-processing"),
    COMPLIANCE("security-audit", "policy-check", "risk-assessment"),
    COPILOT("code-generation", "debugging", "optimization"),
    ANALYTICS("data-mining", "pattern-recognition", "forecasting"),
    SECURITY("threat-detection", "vulnerability-scan", "incident-response");

    private final List<String> defaultSpecializations;

    CapabilityType(String... defaultSpecializations) {
        this.defaultSpecializations = List.of(defaultSpecializations);
    }

    public List<String> defaultSpecializations() {
        return defaultSpecializations;
    }

    /** Lower-case name used in events, seed files and the CLI (e.g. "quantum"). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CapabilityType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Capability type must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown capability type: " + name, e);
        }
    }
}
