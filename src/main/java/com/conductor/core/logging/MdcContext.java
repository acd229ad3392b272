package com.conductor.core.logging;

import org.slf4j.MDC;

/**
 * Manages Conductor-specific MDC keys for structured logging.
 * <p>
 * {@link #service} returns a scope that restores the previous values on close, so
 * nested operations (a restart calling stop and start) keep the outer context.
 */
public final class MdcContext {

    public static final String SERVICE_ID = "serviceId";
    public static final String OPERATION = "operation";

    private MdcContext() {}

    public static Scope service(String serviceId, String operation) {
        String previousService = MDC.get(SERVICE_ID);
        String previousOperation = MDC.get(OPERATION);
        MDC.put(SERVICE_ID, serviceId);
        MDC.put(OPERATION, operation);
        return () -> {
            restore(SERVICE_ID, previousService);
            restore(OPERATION, previousOperation);
        };
    }

    public static void clear() {
        MDC.remove(SERVICE_ID);
        MDC.remove(OPERATION);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
