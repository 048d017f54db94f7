package io.agentrelay.storage;

/**
 * Raised when the durable task store cannot complete a read or write.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
