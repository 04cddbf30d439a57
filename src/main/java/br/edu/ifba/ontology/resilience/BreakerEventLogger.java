package br.edu.ifba.ontology.resilience;

import io.smallrye.faulttolerance.api.CircuitBreakerState;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging of circuit breaker events.
 *
 * <h2>MDC Context:</h2>
 * <ul>
 *   <li><code>breaker.name</code> - the breaker reporting the event</li>
 *   <li><code>breaker.from</code> - state before the transition</li>
 *   <li><code>breaker.to</code> - state after the transition</li>
 *   <li><code>breaker.failures</code> - transient failures counted when the event happened</li>
 * </ul>
 *
 * <h2>Log Format Example:</h2>
 * <pre>
 * WARN  [BreakerEventLogger] Circuit breaker storage CLOSED -&gt; OPEN after 5 failures: TransientStorageException - Connection reset
 * INFO  [BreakerEventLogger] Circuit breaker storage OPEN -&gt; HALF_OPEN after 5 failures
 * INFO  [BreakerEventLogger] Circuit breaker storage HALF_OPEN -&gt; CLOSED after 0 failures
 * </pre>
 */
@ApplicationScoped
public class BreakerEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(BreakerEventLogger.class);

    private static final String MDC_BREAKER_NAME = "breaker.name";
    private static final String MDC_BREAKER_FROM = "breaker.from";
    private static final String MDC_BREAKER_TO = "breaker.to";
    private static final String MDC_BREAKER_FAILURES = "breaker.failures";

    private static final int MAX_MESSAGE_LENGTH = 200;

    /**
     * Logs a state transition. Transitions into OPEN are warnings, the rest informational.
     *
     * @param breakerName the breaker
     * @param from previous state
     * @param to new state
     * @param failures failure count at transition time
     * @param cause the failure that triggered the transition (may be null)
     */
    public void logTransition(final String breakerName, final CircuitBreakerState from, final CircuitBreakerState to,
                              final int failures, final Throwable cause) {
        try {
            MDC.put(MDC_BREAKER_NAME, breakerName);
            MDC.put(MDC_BREAKER_FROM, from.name());
            MDC.put(MDC_BREAKER_TO, to.name());
            MDC.put(MDC_BREAKER_FAILURES, String.valueOf(failures));

            if (to == CircuitBreakerState.OPEN) {
                final String exceptionName = cause != null ? cause.getClass().getSimpleName() : "unknown";
                final String message = cause != null ? cause.getMessage() : "no message";
                logger.warn("Circuit breaker {} {} -> {} after {} failures: {} - {}",
                    breakerName, from, to, failures, exceptionName, truncateMessage(message));
            } else {
                logger.info("Circuit breaker {} {} -> {} after {} failures", breakerName, from, to, failures);
            }
        } finally {
            clearMDC();
        }
    }

    /**
     * Logs a call rejected while the breaker is open.
     *
     * @param breakerName the breaker
     * @param operation the rejected operation
     */
    public void logRejected(final String breakerName, final String operation) {
        try {
            MDC.put(MDC_BREAKER_NAME, breakerName);
            MDC.put(MDC_BREAKER_TO, CircuitBreakerState.OPEN.name());
            logger.debug("Circuit breaker {} rejected {}", breakerName, operation);
        } finally {
            clearMDC();
        }
    }

    private void clearMDC() {
        MDC.remove(MDC_BREAKER_NAME);
        MDC.remove(MDC_BREAKER_FROM);
        MDC.remove(MDC_BREAKER_TO);
        MDC.remove(MDC_BREAKER_FAILURES);
    }

    private String truncateMessage(final String message) {
        if (message == null) {
            return "null";
        }
        if (message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
