package com.trendscope.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker pool size and per-task time budget.
 *
 * @since 1.0.0
 */
public class ExecutionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Worker threads; {@code 0} means one per available processor. */
    private int parallelism = 0;

    private long taskTimeoutSeconds = 60;

    /**
     * @throws IllegalStateException if any value is out of range
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (parallelism < 0) {
            errors.add("'parallelism' must be >= 0, got: " + parallelism);
        }
        if (taskTimeoutSeconds < 1) {
            errors.add("'taskTimeoutSeconds' must be >= 1, got: " + taskTimeoutSeconds);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid execution settings: " + String.join("; ", errors));
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public long getTaskTimeoutSeconds() {
        return taskTimeoutSeconds;
    }

    public void setTaskTimeoutSeconds(long taskTimeoutSeconds) {
        this.taskTimeoutSeconds = taskTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "ExecutionSettings{parallelism=" + parallelism + ", taskTimeoutSeconds=" + taskTimeoutSeconds + '}';
    }
}
