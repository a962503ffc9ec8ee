package mta.eda.receipts.model.schedule;

/**
 * Lifecycle of one scheduler run.
 */
public enum RunState {
    IDLE,
    SCHEDULED,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
