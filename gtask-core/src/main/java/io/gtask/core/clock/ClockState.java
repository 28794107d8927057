package io.gtask.core.clock;

public enum ClockState {
    IDLE,
    EVALUATING,
    DISPATCHING,
    STOPPED
}
