package com.sprout.bot.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("EventContextHolder")
class EventContextHolderTest {

    @AfterEach
    void tearDown() {
        EventContextHolder.clear();
    }

    @Test
    @DisplayName("set publishes the event to the MDC and clear removes it")
    void setAndClear() {
        EventContextHolder.set(new EventContext("e-1", 10L, 20L));

        assertThat(MDC.get(EventContext.MDC_EVENT_ID)).isEqualTo("e-1");
        assertThat(MDC.get(EventContext.MDC_CHAT_ID)).isEqualTo("10");
        assertThat(MDC.get(EventContext.MDC_USER_ID)).isEqualTo("20");

        EventContextHolder.clear();

        assertThat(EventContextHolder.get()).isEmpty();
        assertThat(MDC.get(EventContext.MDC_EVENT_ID)).isNull();
    }

    @Test
    @DisplayName("runWithContext restores the outer context")
    void restoresOuterContext() {
        var outer = new EventContext("outer", 1L, 1L);
        var inner = new EventContext("inner", 2L, 2L);
        AtomicReference<String> seen = new AtomicReference<>();
        EventContextHolder.set(outer);

        EventContextHolder.runWithContext(inner, () -> seen.set(MDC.get(EventContext.MDC_EVENT_ID)));

        assertThat(seen).hasValue("inner");
        assertThat(EventContextHolder.get()).contains(outer);
        assertThat(MDC.get(EventContext.MDC_EVENT_ID)).isEqualTo("outer");
    }

    @Test
    @DisplayName("runWithContext clears the context even when the work throws")
    void clearsOnFailure() {
        assertThatThrownBy(() -> EventContextHolder.runWithContext(new EventContext("e-2", 3L, 3L), () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(EventContextHolder.get()).isEmpty();
        assertThat(MDC.get(EventContext.MDC_EVENT_ID)).isNull();
    }

    @Test
    @DisplayName("rejects a null context")
    void rejectsNull() {
        assertThatThrownBy(() -> EventContextHolder.set(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
