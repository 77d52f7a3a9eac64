package lab.relay.common.logging;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequireCorrelationIdFilterTest {

    private RequireCorrelationIdFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RequireCorrelationIdFilter();
        filter.setContext(new LoggerContext());
    }

    @Test
    void eventWithCorrelationId_isNeutral() {
        filter.start();

        assertThat(filter.decide(event(Map.of("correlationId", "poll-7")))).isEqualTo(FilterReply.NEUTRAL);
    }

    @Test
    void eventWithoutCorrelationId_isDenied() {
        filter.start();

        assertThat(filter.decide(event(Map.of()))).isEqualTo(FilterReply.DENY);
        assertThat(filter.decide(event(Map.of("correlationId", " ")))).isEqualTo(FilterReply.DENY);
    }

    @Test
    void customKey_isHonoured() {
        filter.setMdcKey("account");
        filter.start();

        assertThat(filter.decide(event(Map.of("account", "0xabc")))).isEqualTo(FilterReply.NEUTRAL);
        assertThat(filter.decide(event(Map.of("correlationId", "req-1")))).isEqualTo(FilterReply.DENY);
    }

    @Test
    void blankKey_keepsFilterStoppedAndDenies() {
        filter.setMdcKey("");
        filter.start();

        assertThat(filter.isStarted()).isFalse();
        assertThat(filter.decide(event(Map.of("correlationId", "req-1")))).isEqualTo(FilterReply.DENY);
    }

    private static LoggingEvent event(Map<String, String> mdc) {
        LoggingEvent event = new LoggingEvent();
        event.setMDCPropertyMap(mdc);
        return event;
    }
}
