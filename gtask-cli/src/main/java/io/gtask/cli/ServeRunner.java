package io.gtask.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface ServeRunner {
    int run(Path cronFileOverride, boolean importCronFile) throws Exception;
}
