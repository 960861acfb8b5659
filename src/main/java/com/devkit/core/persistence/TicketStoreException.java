package com.devkit.core.persistence;

/**
 * Thrown when the ticket store cannot be read or written.
 */
public class TicketStoreException extends RuntimeException {

    public TicketStoreException(String message) {
        super(message);
    }

    public TicketStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
