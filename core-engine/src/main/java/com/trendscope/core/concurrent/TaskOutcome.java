package com.trendscope.core.concurrent;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one task run by {@link AnalysisExecutor}: a value, a failure or a
 * timeout.
 *
 * @param <V> value type
 * @since 1.0.0
 */
public final class TaskOutcome<V> {

    /** How the task ended. */
    public enum Status {
        SUCCEEDED, FAILED, TIMED_OUT
    }

    private final Status status;
    private final V value;
    private final Throwable error;

    private TaskOutcome(Status status, V value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <V> TaskOutcome<V> succeeded(V value) {
        return new TaskOutcome<>(Status.SUCCEEDED, value, null);
    }

    public static <V> TaskOutcome<V> failed(Throwable error) {
        return new TaskOutcome<>(Status.FAILED, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public static <V> TaskOutcome<V> timedOut() {
        return new TaskOutcome<>(Status.TIMED_OUT, null, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public Optional<V> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return short reason for a non-successful outcome, {@code null} on success
     */
    public String describeFailure() {
        return switch (status) {
            case SUCCEEDED -> null;
            case TIMED_OUT -> "timed out";
            case FAILED -> error.getClass().getSimpleName()
                    + (error.getMessage() != null ? ": " + error.getMessage() : "");
        };
    }

    @Override
    public String toString() {
        return "TaskOutcome{" + status + (error != null ? ", error=" + error.getMessage() : "") + '}';
    }
}
