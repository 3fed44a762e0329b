package io.bankseed.error;

/**
 * A record referenced an identifier that no earlier stage produced. Never retried.
 */
public class IntegrityException extends BankSeedException {
    public IntegrityException(String message) {
        super(message);
    }
}
