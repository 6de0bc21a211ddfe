/*
 * Copyright Walstream Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.walstream.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

public class LoggingContextTest {

    @AfterEach
    public void clear() {
        MDC.clear();
    }

    @Test
    public void shouldSetAndRestoreStreamContext() {
        MDC.put("other", "value");
        LoggingContext.PreviousContext previous = LoggingContext.forStream("slot_1", "inventory", "streaming");
        assertThat(MDC.get(LoggingContext.SLOT_NAME)).isEqualTo("slot_1");
        assertThat(MDC.get(LoggingContext.DATABASE_NAME)).isEqualTo("inventory");
        assertThat(MDC.get(LoggingContext.CONTEXT)).isEqualTo("streaming");

        previous.restore();
        assertThat(MDC.get(LoggingContext.SLOT_NAME)).isNull();
        assertThat(MDC.get("other")).isEqualTo("value");
    }

    @Test
    public void shouldCaptureCurrentContextWithoutChangingIt() {
        MDC.put(LoggingContext.CONTEXT, "consumer");
        LoggingContext.PreviousContext current = LoggingContext.current();
        assertThat(MDC.get(LoggingContext.CONTEXT)).isEqualTo("consumer");

        LoggingContext.forStream("slot_1", null, "streaming");
        assertThat(MDC.get(LoggingContext.DATABASE_NAME)).isNull();
        current.restore();
        assertThat(MDC.get(LoggingContext.CONTEXT)).isEqualTo("consumer");
        assertThat(MDC.get(LoggingContext.SLOT_NAME)).isNull();
    }
}
