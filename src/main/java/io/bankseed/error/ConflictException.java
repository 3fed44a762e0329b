package io.bankseed.error;

public class ConflictException extends BankSeedException {
    public ConflictException(String message) {
        super(message);
    }
}
