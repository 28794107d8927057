package io.gtask.cli;

import io.gtask.core.error.ExecutionNotFoundException;
import io.gtask.core.query.RunReport;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Print the full record of one execution")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Task uid")
    String uid;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.print(RunReport.render(context.queries().fetch(uid), context.zone()));
            return 0;
        } catch (ExecutionNotFoundException e) {
            System.err.println(e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Show command failed: " + e.getMessage());
            return 1;
        }
    }
}
