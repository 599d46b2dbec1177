package com.switchboard.core.logging;

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
    @DisplayName("setPlan puts planId in MDC")
    void setPlan() {
        MdcContext.setPlan("PLAN-1234");
        assertEquals("PLAN-1234", MDC.get("planId"));
    }

    @Test
    @DisplayName("setTask puts planId, taskIndex and worker in MDC")
    void setTask() {
        MdcContext.setTask("PLAN-1234", 3, "architect");
        assertEquals("PLAN-1234", MDC.get("planId"));
        assertEquals("3", MDC.get("taskIndex"));
        assertEquals("architect", MDC.get("worker"));
    }

    @Test
    @DisplayName("setTask with null worker leaves worker unset")
    void setTaskNullWorker() {
        MdcContext.setTask("PLAN-1234", 0, null);
        assertNull(MDC.get("worker"));
    }

    @Test
    @DisplayName("clearToolHandler removes only the handler key")
    void clearToolHandler() {
        MdcContext.setPlan("PLAN-1234");
        MdcContext.setToolHandler("docs");
        assertEquals("docs", MDC.get("toolHandler"));

        MdcContext.clearToolHandler();

        assertNull(MDC.get("toolHandler"));
        assertEquals("PLAN-1234", MDC.get("planId"));
    }

    @Test
    @DisplayName("clear removes all switchboard MDC keys")
    void clear() {
        MdcContext.setTask("PLAN-1234", 1, "architect");
        MdcContext.setToolHandler("docs");
        MdcContext.clear();
        assertNull(MDC.get("planId"));
        assertNull(MDC.get("taskIndex"));
        assertNull(MDC.get("worker"));
        assertNull(MDC.get("toolHandler"));
    }
}
