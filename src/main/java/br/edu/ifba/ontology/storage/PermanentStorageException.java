package br.edu.ifba.ontology.storage;

/**
 * Storage failure that will not go away by retrying (schema violation, rejected
 * write). Surfaced immediately; does not count toward the circuit breaker threshold.
 */
public class PermanentStorageException extends StorageException {

    public PermanentStorageException(String message) {
        super(message);
    }

    public PermanentStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
