package io.tick4j.core;

/**
 * @param error message of the failure when {@code status == ERRORED}, otherwise null
 */
public record JobOutcome(String name, Status status, String error) {

    public enum Status {
        RAN,
        SKIPPED_DISABLED,
        SKIPPED_NOT_DUE,
        ERRORED
    }

    public static JobOutcome ran(String name) {
        return new JobOutcome(name, Status.RAN, null);
    }

    public static JobOutcome skippedDisabled(String name) {
        return new JobOutcome(name, Status.SKIPPED_DISABLED, null);
    }

    public static JobOutcome skippedNotDue(String name) {
        return new JobOutcome(name, Status.SKIPPED_NOT_DUE, null);
    }

    public static JobOutcome errored(String name, Throwable error) {
        String msg = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return new JobOutcome(name, Status.ERRORED, msg);
    }

    public boolean attempted() {
        return status == Status.RAN || status == Status.ERRORED;
    }
}
