package com.conductor.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Test
    @DisplayName("service scope sets and clears the keys")
    void setsAndClears() {
        try (var scope = MdcContext.service("db", "start")) {
            assertEquals("db", MDC.get(MdcContext.SERVICE_ID));
            assertEquals("start", MDC.get(MdcContext.OPERATION));
        }
        assertNull(MDC.get(MdcContext.SERVICE_ID));
        assertNull(MDC.get(MdcContext.OPERATION));
    }

    @Test
    @DisplayName("nested scope restores the outer values")
    void nested() {
        try (var outer = MdcContext.service("api", "restart")) {
            try (var inner = MdcContext.service("db", "stop")) {
                assertEquals("db", MDC.get(MdcContext.SERVICE_ID));
            }
            assertEquals("api", MDC.get(MdcContext.SERVICE_ID));
            assertEquals("restart", MDC.get(MdcContext.OPERATION));
        }
    }

    @Test
    @DisplayName("clear removes only Conductor keys")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.service("db", "start");

        MdcContext.clear();

        assertNull(MDC.get(MdcContext.SERVICE_ID));
        assertEquals("kept", MDC.get("other"));
    }
}
