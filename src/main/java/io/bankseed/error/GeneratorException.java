package io.bankseed.error;

public class GeneratorException extends BankSeedException {
    public GeneratorException(String message) {
        super(message);
    }

    public GeneratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
