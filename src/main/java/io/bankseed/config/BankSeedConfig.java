package io.bankseed.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BankSeedConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "bankseed-settings.json";

    private final Path rootDir;

    public BankSeedConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BankSeedConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BankSeedConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("bankseed.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
