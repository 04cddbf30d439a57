package br.edu.ifba.ontology.storage;

/**
 * Storage failure that may succeed on a later attempt (connection lost, timeout,
 * pool exhausted). Counts toward the circuit breaker failure threshold.
 */
public class TransientStorageException extends StorageException {

    public TransientStorageException(String message) {
        super(message);
    }

    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
