package io.bankseed;

import io.bankseed.cli.BankSeedCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new BankSeedCommand()).execute(args);
        System.exit(code);
    }
}
