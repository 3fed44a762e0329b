package io.bankseed.error;

/**
 * Storage was unavailable, timed out or rejected a write.
 */
public class PersistenceException extends BankSeedException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
