package com.trendscope.core.concurrent;

import com.trendscope.core.InvalidParameterException;
import com.trendscope.core.config.ExecutionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for per-entity, per-pair and per-model work.
 *
 * <h3>Time budget</h3>
 * <p>
 * Each task gets a budget measured from the moment a worker picks it up, not
 * from submission, so queued tasks are not penalised for waiting. When the
 * budget expires the worker thread is interrupted; model loops observe this
 * through {@link Cancellation#checkpoint()}. A task that overran its budget
 * is reported as {@link TaskOutcome.Status#TIMED_OUT} and never aborts its
 * siblings.
 * </p>
 *
 * <p>
 * A task that ignores the interrupt is abandoned: once it is
 * {@link #ABANDON_GRACE} past its budget the caller stops waiting, cancels
 * the future and reports the task as timed out. The worker stays busy until
 * the task returns on its own. Inline nested tasks cannot be abandoned.
 * </p>
 *
 * <h3>Nesting</h3>
 * <p>
 * {@link #invokeAll(Map)} called from one of this pool's own workers runs the
 * tasks inline on the calling thread. A fixed pool waiting on itself would
 * otherwise deadlock once every worker is blocked on nested work.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisExecutor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisExecutor.class);

    /** How long past its budget a task that ignores the interrupt is waited for. */
    public static final Duration ABANDON_GRACE = Duration.ofMillis(250);

    private final int parallelism;
    private final Duration taskBudget;
    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final ThreadLocal<Boolean> workerThread = ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * @param parallelism number of worker threads; {@code 0} means one per
     *                    available processor
     * @param taskBudget  maximum run time of a single task
     * @throws InvalidParameterException if {@code parallelism} is negative or
     *                                   the budget is not positive
     */
    public AnalysisExecutor(int parallelism, Duration taskBudget) {
        InvalidParameterException.requireAtLeast("parallelism", parallelism, 0);
        Objects.requireNonNull(taskBudget, "taskBudget must not be null");
        if (taskBudget.isNegative() || taskBudget.isZero()) {
            throw new InvalidParameterException("taskBudget", "must be positive, got: " + taskBudget);
        }
        this.parallelism = parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism;
        this.taskBudget = taskBudget;
        this.workers = Executors.newFixedThreadPool(this.parallelism, workerFactory());
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonFactory("analysis-watchdog"));
        LOG.info("Analysis executor started: {} worker(s), task budget {}", this.parallelism, taskBudget);
    }

    public static AnalysisExecutor fromSettings(ExecutionSettings settings) {
        Objects.requireNonNull(settings, "ExecutionSettings must not be null");
        return new AnalysisExecutor(settings.getParallelism(), Duration.ofSeconds(settings.getTaskTimeoutSeconds()));
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Run every task and wait for all of them.
     *
     * @param tasks keyed tasks; iteration order of the map is preserved
     * @return outcome per key, in the order of {@code tasks}
     */
    public <K, V> Map<K, TaskOutcome<V>> invokeAll(Map<K, ? extends Callable<V>> tasks) {
        Objects.requireNonNull(tasks, "tasks must not be null");
        Map<K, TaskOutcome<V>> outcomes = new LinkedHashMap<>();
        if (workerThread.get()) {
            tasks.forEach((key, task) -> outcomes.put(key, runInline(key, new BudgetedTask<>(task))));
            return outcomes;
        }

        Map<K, BudgetedTask<V>> budgeted = new LinkedHashMap<>();
        Map<K, Future<V>> futures = new LinkedHashMap<>();
        tasks.forEach((key, task) -> {
            BudgetedTask<V> wrapped = new BudgetedTask<>(task);
            budgeted.put(key, wrapped);
            futures.put(key, workers.submit(wrapped));
        });

        for (Map.Entry<K, Future<V>> entry : futures.entrySet()) {
            K key = entry.getKey();
            outcomes.put(key, await(key, entry.getValue(), budgeted.get(key)));
        }
        return outcomes;
    }

    /**
     * Run a single task under the time budget.
     */
    public <V> TaskOutcome<V> invoke(String name, Callable<V> task) {
        return invokeAll(Map.of(name, task)).get(name);
    }

    public int getParallelism() {
        return parallelism;
    }

    public Duration getTaskBudget() {
        return taskBudget;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        watchdog.shutdownNow();
        LOG.info("Analysis executor stopped");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <K, V> TaskOutcome<V> await(K key, Future<V> future, BudgetedTask<V> task) {
        try {
            V value = getWithinBudget(future, task);
            if (value == null && task.abandoned) {
                LOG.warn("Task [{}] ignored its {} budget; abandoned", key, taskBudget);
                return TaskOutcome.timedOut();
            }
            if (task.expired) {
                LOG.warn("Task [{}] finished after its {} budget; discarding result", key, taskBudget);
                return TaskOutcome.timedOut();
            }
            return TaskOutcome.succeeded(value);
        } catch (ExecutionException e) {
            return classifyFailure(key, e.getCause(), task);
        } catch (CancellationException e) {
            return classifyFailure(key, e, task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            LOG.warn("Interrupted while waiting for task [{}]", key);
            return TaskOutcome.failed(e);
        }
    }

    /**
     * Wait for the task, but no longer than its budget plus
     * {@link #ABANDON_GRACE} from the moment it started. Returns {@code null}
     * and marks the task abandoned when that deadline passes.
     */
    private <V> V getWithinBudget(Future<V> future, BudgetedTask<V> task)
            throws ExecutionException, InterruptedException {
        long allowance = taskBudget.plus(ABANDON_GRACE).toNanos();
        while (true) {
            long started = task.startedAt;
            long wait = started == 0 ? allowance : Math.max(0, allowance - (System.nanoTime() - started));
            try {
                return future.get(wait, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // a task still queued when the wait began gets a full allowance from its start
                if (started != 0) {
                    task.abandon();
                    future.cancel(true);
                    return null;
                }
            }
        }
    }

    private <K, V> TaskOutcome<V> runInline(K key, BudgetedTask<V> task) {
        try {
            V value = task.call();
            return task.expired ? TaskOutcome.timedOut() : TaskOutcome.succeeded(value);
        } catch (Exception e) {
            return classifyFailure(key, e, task);
        }
    }

    private <K, V> TaskOutcome<V> classifyFailure(K key, Throwable cause, BudgetedTask<V> task) {
        if (task.expired) {
            LOG.warn("Task [{}] exceeded its {} budget and was cancelled", key, taskBudget);
            return TaskOutcome.timedOut();
        }
        LOG.error("Task [{}] failed: {}", key, cause.getMessage(), cause);
        return TaskOutcome.failed(cause);
    }

    private ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(() -> {
                workerThread.set(Boolean.TRUE);
                runnable.run();
            }, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static ThreadFactory daemonFactory(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Arms the watchdog when the task starts and disarms it when it ends. The
     * lock guarantees the interrupt can only land while the task is still
     * running on the worker.
     */
    private final class BudgetedTask<V> implements Callable<V> {

        private final Callable<V> delegate;
        private final Object lock = new Object();
        private boolean finished;
        private volatile boolean expired;
        private volatile boolean abandoned;
        private volatile long startedAt;

        BudgetedTask(Callable<V> delegate) {
            this.delegate = Objects.requireNonNull(delegate, "task must not be null");
        }

        @Override
        public V call() throws Exception {
            Thread worker = Thread.currentThread();
            startedAt = System.nanoTime();
            ScheduledFuture<?> alarm = watchdog.schedule(() -> {
                synchronized (lock) {
                    if (!finished) {
                        expired = true;
                        worker.interrupt();
                    }
                }
            }, taskBudget.toMillis(), TimeUnit.MILLISECONDS);
            try {
                return delegate.call();
            } finally {
                synchronized (lock) {
                    finished = true;
                }
                alarm.cancel(false);
                if (expired) {
                    // clear our own interrupt so the thread can serve the next task
                    Thread.interrupted();
                }
            }
        }

        void abandon() {
            synchronized (lock) {
                expired = true;
                abandoned = true;
            }
        }
    }
}
