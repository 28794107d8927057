package io.gtask.core.config;

import java.io.IOException;
import java.nio.file.Files;

public final class DirectoryBootstrap {

    private DirectoryBootstrap() {
    }

    public static void ensureDirectories(GtaskConfig config) throws IOException {
        Files.createDirectories(config.logDir());
        Files.createDirectories(config.runsDir());
        Files.createDirectories(config.dbDir());
    }
}
