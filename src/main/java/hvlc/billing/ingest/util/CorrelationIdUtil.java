package hvlc.billing.ingest.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation ID helpers over the SLF4J MDC.
 *
 * HTTP requests get their ID from CorrelationIdFilter; batch runs set one
 * per processed file.
 */
public class CorrelationIdUtil {

    public static final String CORRELATION_ID_KEY = "correlationId";

    private CorrelationIdUtil() {
    }

    /**
     * @return correlation ID or "NO-CORRELATION-ID" if not set
     */
    public static String getCurrentCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : "NO-CORRELATION-ID";
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Always call in a finally block.
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }
}
