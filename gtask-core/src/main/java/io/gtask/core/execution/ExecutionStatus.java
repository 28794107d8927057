package io.gtask.core.execution;

public enum ExecutionStatus {
    SUCCESS("Success"),
    FAILURE("Failure");

    private final String label;

    ExecutionStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ExecutionStatus ofExitCode(int exitCode) {
        return exitCode == 0 ? SUCCESS : FAILURE;
    }

    public static ExecutionStatus fromLabel(String value) {
        for (ExecutionStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown execution status: " + value);
    }
}
