/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.util;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import org.slf4j.MDC;

/**
 * A utility that provides a consistent set of properties for the Mapped Diagnostic Context (MDC) properties used by
 * the streaming components.
 */
public class LoggingContext {

    /**
     * The key for the replication slot MDC property.
     */
    public static final String SLOT_NAME = "walstream.slot";
    /**
     * The key for the database name MDC property.
     */
    public static final String DATABASE_NAME = "walstream.database";
    /**
     * The key for the context name MDC property.
     */
    public static final String CONTEXT = "walstream.context";

    private LoggingContext() {
    }

    /**
     * A snapshot of an MDC context that can be {@link #restore()}.
     */
    public static final class PreviousContext {
        private static final Map<String, String> EMPTY_CONTEXT = Collections.emptyMap();
        private final Map<String, String> context;

        protected PreviousContext() {
            Map<String, String> context = MDC.getCopyOfContextMap();
            this.context = context != null ? context : EMPTY_CONTEXT;
        }

        /**
         * Restore this logging context.
         */
        public void restore() {
            MDC.setContextMap(context);
        }
    }

    /**
     * Capture the MDC context of the calling thread without changing it.
     *
     * @return the current MDC context; never null
     */
    public static PreviousContext current() {
        return new PreviousContext();
    }

    /**
     * Configure for a stream the logger's Mapped Diagnostic Context (MDC) properties for the thread making this call.
     *
     * @param slotName the name of the replication slot; may not be null
     * @param databaseName the name of the source database; may be null
     * @param contextName the name of the context; may not be null
     * @return the previous MDC context; never null
     * @throws NullPointerException if {@code slotName} or {@code contextName} is null
     */
    public static PreviousContext forStream(String slotName, String databaseName, String contextName) {
        Objects.requireNonNull(slotName, "The MDC value for the slot name may not be null");
        Objects.requireNonNull(contextName, "The MDC value for the context may not be null");

        PreviousContext previous = new PreviousContext();
        if (databaseName != null) {
            MDC.put(DATABASE_NAME, databaseName);
        }
        MDC.put(SLOT_NAME, slotName);
        MDC.put(CONTEXT, contextName);
        return previous;
    }
}
