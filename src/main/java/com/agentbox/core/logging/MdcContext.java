package com.agentbox.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing daemon-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSandbox(String sandboxId) {
        if (sandboxId != null) {
            MDC.put("sandboxId", sandboxId);
        }
    }

    public static void setTurn(String sandboxId, int turnIndex) {
        setSandbox(sandboxId);
        MDC.put("turnIndex", String.valueOf(turnIndex));
    }

    public static void clear() {
        MDC.remove("sandboxId");
        MDC.remove("turnIndex");
    }
}
