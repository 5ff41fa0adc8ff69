package com.trendscope.core.concurrent;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.config.ExecutionSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnalysisExecutor}.
 */
class AnalysisExecutorTest {

    private AnalysisExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new AnalysisExecutor(2, Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    @DisplayName("Should return outcomes in task order")
    void shouldKeepTaskOrder() {
        Map<String, Callable<Integer>> tasks = new LinkedHashMap<>();
        tasks.put("slow", () -> {
            Thread.sleep(50);
            return 1;
        });
        tasks.put("fast", () -> 2);
        tasks.put("third", () -> 3);

        Map<String, TaskOutcome<Integer>> outcomes = executor.invokeAll(tasks);

        assertThat(outcomes.keySet()).containsExactly("slow", "fast", "third");
        assertThat(outcomes.get("slow").getValue()).contains(1);
        assertThat(outcomes.get("third").isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should isolate a failing task from the others")
    void shouldIsolateFailures() {
        Map<String, Callable<String>> tasks = new LinkedHashMap<>();
        tasks.put("broken", () -> {
            throw new IllegalStateException("boom");
        });
        tasks.put("fine", () -> "ok");

        Map<String, TaskOutcome<String>> outcomes = executor.invokeAll(tasks);

        TaskOutcome<String> broken = outcomes.get("broken");
        assertThat(broken.getStatus()).isEqualTo(TaskOutcome.Status.FAILED);
        assertThat(broken.getError()).containsInstanceOf(IllegalStateException.class);
        assertThat(broken.describeFailure()).isEqualTo("IllegalStateException: boom");
        assertThat(outcomes.get("fine").getValue()).contains("ok");
    }

    @Test
    @DisplayName("Should time out a task that exceeds its budget")
    void shouldTimeOutSlowTask() {
        TaskOutcome<String> outcome = executor.invoke("sleeper", () -> {
            Thread.sleep(10_000);
            return "late";
        });

        assertThat(outcome.getStatus()).isEqualTo(TaskOutcome.Status.TIMED_OUT);
        assertThat(outcome.getValue()).isEmpty();
        assertThat(outcome.describeFailure()).isEqualTo("timed out");
    }

    @Test
    @DisplayName("Should stop a cooperative loop at its next checkpoint")
    void shouldCancelAtCheckpoint() {
        TaskOutcome<Long> outcome = executor.invoke("spinner", () -> {
            long spins = 0;
            while (true) {
                Cancellation.checkpoint();
                spins++;
                if (spins < 0) {
                    return spins;
                }
            }
        });

        assertThat(outcome.getStatus()).isEqualTo(TaskOutcome.Status.TIMED_OUT);
    }

    @Test
    @DisplayName("Should give up on a task that ignores the interrupt")
    void shouldAbandonUncooperativeTask() {
        AtomicBoolean release = new AtomicBoolean();
        try {
            long start = System.nanoTime();
            TaskOutcome<String> outcome = executor.invoke("stubborn", () -> {
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                return "late";
            });
            Duration waited = Duration.ofNanos(System.nanoTime() - start);

            assertThat(outcome.getStatus()).isEqualTo(TaskOutcome.Status.TIMED_OUT);
            assertThat(waited).isGreaterThanOrEqualTo(Duration.ofMillis(500));
            assertThat(waited).isLessThan(Duration.ofSeconds(5));
        } finally {
            release.set(true);
        }
    }

    @Test
    @DisplayName("Should run nested task groups inline on the worker")
    void shouldRunNestedTasksInline() {
        try (AnalysisExecutor single = new AnalysisExecutor(1, Duration.ofSeconds(5))) {
            TaskOutcome<Integer> outcome = single.invoke("outer", () -> {
                Map<String, Callable<Integer>> inner = new LinkedHashMap<>();
                inner.put("a", () -> 20);
                inner.put("b", () -> 22);
                return single.invokeAll(inner).values().stream()
                        .mapToInt(o -> o.getValue().orElse(0))
                        .sum();
            });

            assertThat(outcome.getValue()).contains(42);
        }
    }

    @Test
    @DisplayName("Should use one worker per processor for parallelism 0")
    void shouldResolveParallelismFromSettings() {
        ExecutionSettings settings = new ExecutionSettings();
        settings.setTaskTimeoutSeconds(3);

        try (AnalysisExecutor fromSettings = AnalysisExecutor.fromSettings(settings)) {
            assertThat(fromSettings.getParallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
            assertThat(fromSettings.getTaskBudget()).isEqualTo(Duration.ofSeconds(3));
        }
    }

    @Test
    @DisplayName("Should reject a non-positive budget")
    void shouldRejectBudget() {
        assertThatThrownBy(() -> new AnalysisExecutor(1, Duration.ZERO))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("taskBudget");
    }

    @Test
    @DisplayName("Should throw at a checkpoint on an interrupted thread")
    void shouldThrowOnInterruptedCheckpoint() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(Cancellation::checkpoint).isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
