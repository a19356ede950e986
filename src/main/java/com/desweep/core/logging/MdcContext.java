package com.desweep.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for structured logging of analysis runs.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String ENTITY_KEY = "entityKey";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setEntity(String runId, String entityKey) {
        MDC.put(RUN_ID, runId);
        MDC.put(ENTITY_KEY, entityKey);
    }

    public static void clearEntity() {
        MDC.remove(ENTITY_KEY);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(ENTITY_KEY);
    }
}
