package io.gtask.cli;

import picocli.CommandLine.Command;

@Command(name = "gtask", mixinStandardHelpOptions = true, description = "Cron-style shell job scheduler")
public final class GtaskCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
