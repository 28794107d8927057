package io.gtask.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Import the job file, start the trigger clock and the status endpoint")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--cron-file"}, description = "Job file to import instead of CRON_FILE")
    Path cronFile;

    @Option(names = {"--no-import"}, description = "Skip importing the job file")
    boolean noImport;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serveRunner().run(cronFile, !noImport);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
