package com.backstop.core.logging;

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
    @DisplayName("setComponent puts domain and componentId in MDC")
    void setComponent() {
        MdcContext.setComponent("glass", "GlassCard");
        assertEquals("glass", MDC.get("domain"));
        assertEquals("GlassCard", MDC.get("componentId"));
    }

    @Test
    @DisplayName("clearRecord removes only the record id")
    void clearRecord() {
        MdcContext.setComponent("component", "ModernToggleSwitch");
        MdcContext.setRecord("crash_1_abcdef12");
        MdcContext.clearRecord();
        assertNull(MDC.get("recordId"));
        assertEquals("ModernToggleSwitch", MDC.get("componentId"));
    }

    @Test
    @DisplayName("clear removes all backstop MDC keys")
    void clear() {
        MdcContext.setComponent("component", "SettingsFragment");
        MdcContext.setRecord("crash_1_abcdef12");
        MdcContext.clear();
        assertNull(MDC.get("domain"));
        assertNull(MDC.get("componentId"));
        assertNull(MDC.get("recordId"));
    }
}
