package io.bankseed.error;

/**
 * Root of the unchecked failure hierarchy. Callers branch on the concrete subtype to decide
 * whether a failure is retried.
 */
public class BankSeedException extends RuntimeException {
    public BankSeedException(String message) {
        super(message);
    }

    public BankSeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
