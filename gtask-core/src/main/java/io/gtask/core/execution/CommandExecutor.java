package io.gtask.core.execution;

import java.time.Duration;

public interface CommandExecutor {

    /**
     * Runs {@code command} to completion and describes the outcome. A failing or unstartable
     * command is reported through the record's status, never thrown.
     *
     * @param timeout deadline after which the command is killed; zero or negative for none
     */
    ExecutionRecord run(String command, Duration timeout);
}
