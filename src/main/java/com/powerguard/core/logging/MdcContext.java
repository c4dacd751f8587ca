package com.powerguard.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for batch and actionable correlation in log lines.
 */
public final class MdcContext {

    public static final String BATCH_ID = "batchId";
    public static final String ACTIONABLE_ID = "actionableId";
    public static final String ACTIONABLE_TYPE = "actionableType";

    private MdcContext() {}

    public static void setBatch(String batchId) {
        MDC.put(BATCH_ID, batchId);
    }

    public static void setActionable(String batchId, String actionableId, String actionableType) {
        MDC.put(BATCH_ID, batchId);
        MDC.put(ACTIONABLE_ID, actionableId);
        MDC.put(ACTIONABLE_TYPE, actionableType);
    }

    public static void clearActionable() {
        MDC.remove(ACTIONABLE_ID);
        MDC.remove(ACTIONABLE_TYPE);
    }

    public static void clear() {
        MDC.remove(BATCH_ID);
        MDC.remove(ACTIONABLE_ID);
        MDC.remove(ACTIONABLE_TYPE);
    }
}
