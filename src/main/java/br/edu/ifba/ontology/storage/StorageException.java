package br.edu.ifba.ontology.storage;

/**
 * Base type of failures raised by a {@link GraphStoragePort}.
 *
 * <p>The subclass tells the circuit breaker whether the failure counts toward its
 * failure threshold.</p>
 */
public abstract class StorageException extends RuntimeException {

    protected StorageException(String message) {
        super(message);
    }

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return true when retrying the same call later may succeed
     */
    public abstract boolean isTransient();
}
