package br.edu.ifba.ontology.resilience;

import br.edu.ifba.ontology.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a storage failure is transient, i.e. whether it counts toward the
 * circuit breaker failure threshold.
 *
 * <h2>Transient (counted):</h2>
 * <ul>
 *   <li>{@link StorageException} whose {@code isTransient()} is true</li>
 *   <li>{@link TimeoutException}, {@link IOException}</li>
 *   <li>a guarded call that ran past its per-call timeout
 *       ({@link org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException})</li>
 *   <li>messages matching known network/connection patterns</li>
 * </ul>
 *
 * <h2>Permanent (not counted):</h2>
 * <ul>
 *   <li>{@link StorageException} whose {@code isTransient()} is false; this
 *       classification is final and stops the cause chain walk</li>
 *   <li>everything else</li>
 * </ul>
 *
 * <p>{@link CompletionException} and {@link ExecutionException} wrappers are unwrapped.</p>
 */
public final class TransientFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientFailurePredicate.class);

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out|lost|terminated|broken)" +
        "|unable\\s+to\\s+(connect|acquire\\s+connection)" +
        "|connection\\s+pool\\s+(exhausted|timeout)" +
        "|too\\s+many\\s+(connections|clients)" +
        "|network\\s+(is\\s+unreachable|error|timeout)" +
        "|socket\\s+(timeout|closed|reset|error)" +
        "|read\\s+timed\\s*out" +
        "|connect\\s+timed\\s*out" +
        "|server\\s+(closed|shutdown|restarting|not\\s+available)" +
        "|try\\s+(again|later)" +
        "|temporarily\\s+unavailable" +
        "|service\\s+unavailable" +
        ")"
    );

    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public boolean test(final Throwable throwable) {
        Throwable current = unwrap(throwable);
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof StorageException storageException) {
                return storageException.isTransient();
            }
            if (current instanceof TimeoutException
                    || current instanceof org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException
                    || current instanceof IOException) {
                logger.debug("Transient failure type detected: {}", current.getClass().getSimpleName());
                return true;
            }
            if (isTransientByMessage(current.getMessage())) {
                return true;
            }
            Throwable cause = current.getCause();
            current = cause == current ? null : cause;
        }
        return false;
    }

    /**
     * Strips {@link CompletionException} / {@link ExecutionException} layers.
     *
     * @param throwable the failure (may be null)
     * @return the innermost meaningful failure
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private boolean isTransientByMessage(final String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        return TRANSIENT_MESSAGE_PATTERN.matcher(message).find();
    }
}
