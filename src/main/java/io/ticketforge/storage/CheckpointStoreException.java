package io.ticketforge.storage;

public final class CheckpointStoreException extends RuntimeException {
    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
