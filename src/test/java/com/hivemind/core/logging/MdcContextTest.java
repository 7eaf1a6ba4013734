package com.hivemind.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setTask puts taskId in MDC")
    void setTask() {
        MdcContext.setTask("task-000001");
        assertEquals("task-000001", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setAssignment puts taskId, agentId and capability in MDC")
    void setAssignment() {
        MdcContext.setAssignment("task-000001", "nlp-001", "nlp");
        assertEquals("task-000001", MDC.get("taskId"));
        assertEquals("nlp-001", MDC.get("agentId"));
        assertEquals("nlp", MDC.get("capability"));
    }

    @Test
    @DisplayName("setAgent puts agentId in MDC")
    void setAgent() {
        MdcContext.setAgent("quantum-001");
        assertEquals("quantum-001", MDC.get("agentId"));
    }

    @Test
    @DisplayName("clear removes all hivemind MDC keys")
    void clear() {
        MdcContext.setAssignment("task-000001", "nlp-001", "nlp");
        MdcContext.clear();
        assertNull(MDC.get("taskId"));
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("capability"));
    }
}
