package lab.relay.common.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;

import java.util.Map;

/**
 * Passes only events that carry the configured MDC key (by default {@code correlationId}).
 * HTTP requests and monitor poll cycles both set it, so the relay-flow appender reads as a
 * per-request / per-cycle trace without background noise.
 *
 * <pre>
 * &lt;filter class="lab.relay.common.logging.RequireCorrelationIdFilter"&gt;
 *     &lt;mdcKey&gt;correlationId&lt;/mdcKey&gt;
 * &lt;/filter&gt;
 * </pre>
 */
public class RequireCorrelationIdFilter extends Filter<ILoggingEvent> {

    private String mdcKey = "correlationId";

    public void setMdcKey(String mdcKey) {
        this.mdcKey = mdcKey;
    }

    public String getMdcKey() {
        return mdcKey;
    }

    @Override
    public FilterReply decide(ILoggingEvent event) {
        if (event == null || !isStarted()) {
            return FilterReply.DENY;
        }
        Map<String, String> mdc = event.getMDCPropertyMap();
        String value = mdc == null ? null : mdc.get(mdcKey);
        return value == null || value.isBlank() ? FilterReply.DENY : FilterReply.NEUTRAL;
    }

    @Override
    public void start() {
        if (mdcKey == null || mdcKey.isBlank()) {
            addError("mdcKey must be set for " + getName());
            return;
        }
        super.start();
    }
}
