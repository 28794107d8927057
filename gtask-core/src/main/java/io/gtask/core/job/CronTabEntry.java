package io.gtask.core.job;

public record CronTabEntry(int lineNumber, String schedule, String command) {
}
