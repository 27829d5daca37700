package heartdisease.etl.util;

import org.slf4j.MDC;

/**
 * Correlation ID handling on top of SLF4J MDC.
 *
 * HTTP requests get their ID from CorrelationIdFilter; a pipeline run uses its run id,
 * so every log line of one run can be grepped by that id.
 */
public final class CorrelationIdUtil {

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

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Always call this in finally blocks; MDC is thread-local and threads are pooled.
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }

    /**
     * Set the correlation ID until the returned scope is closed, then restore the previous one.
     * A run started inside an HTTP request logs under the run id and the request id comes back afterwards.
     */
    public static Scope openScope(String correlationId) {
        String previous = MDC.get(CORRELATION_ID_KEY);
        setCorrelationId(correlationId);
        return () -> {
            if (previous != null) {
                setCorrelationId(previous);
            } else {
                clearCorrelationId();
            }
        };
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
