package com.backstop.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Backstop MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setComponent(String domain, String componentId) {
        MDC.put("domain", domain);
        MDC.put("componentId", componentId);
    }

    public static void setRecord(String recordId) {
        MDC.put("recordId", recordId);
    }

    public static void clearRecord() {
        MDC.remove("recordId");
    }

    public static void clear() {
        MDC.remove("domain");
        MDC.remove("componentId");
        MDC.remove("recordId");
    }
}
