package mailtask.coordinator.scheduler;

import mailtask.coordinator.agent.Agent;
import mailtask.coordinator.agent.AgentProgress;
import mailtask.coordinator.agent.CancellationToken;
import mailtask.coordinator.agent.ProcessOptions;
import mailtask.coordinator.agent.TaskCancelledException;
import mailtask.coordinator.config.CoordinatorConfig;
import mailtask.coordinator.model.LogLevel;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStatus;
import mailtask.coordinator.report.TaskReporter;
import mailtask.coordinator.repository.TaskQueue;
import mailtask.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the task queue and runs picked tasks through the agent.
 *
 * <ul>
 * <li>one timer thread runs poll ticks, per-task timeout timers and the optional {@link TaskReaper}</li>
 * <li>attempts run on worker threads; at most {@code maxConcurrent} at a time</li>
 * <li>a timeout cancels the attempt's token; with hard timeouts the attempt is also failed at the deadline</li>
 * <li>{@link #stop()} stops polling and waits for running attempts, up to the shutdown timeout</li>
 * </ul>
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    static final String CANCELLED_MESSAGE = "Task was cancelled (timeout or shutdown).";
    private static final long DRAIN_POLL_MS = 100;

    private final TaskQueue queue;
    private final Agent agent;
    private final TaskReporter reporter;

    private final boolean enabled;
    private final Duration pollInterval;
    private final int maxConcurrent;
    private final Duration taskTimeout;
    private final Duration shutdownTimeout;
    private final boolean hardTimeout;
    private final Duration reaperInterval;
    private final TaskReaper taskReaper;

    private final Map<String, Dispatch> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger processingCount = new AtomicInteger();
    private final Object pollLock = new Object();

    private volatile boolean running = false;
    private volatile boolean draining = false;

    private ScheduledExecutorService timer;
    private ExecutorService workers;
    private ScheduledFuture<?> pollFuture;
    private ScheduledFuture<?> reaperFuture;

    public Scheduler(TaskQueue queue, Agent agent, TaskReporter reporter, CoordinatorConfig config) {
        if (config.maxConcurrent() < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1");
        }
        this.queue = queue;
        this.agent = agent;
        this.reporter = reporter == null ? TaskReporter.NONE : reporter;
        this.enabled = config.schedulerEnabled();
        this.pollInterval = config.pollInterval();
        this.maxConcurrent = config.maxConcurrent();
        this.taskTimeout = config.taskTimeout();
        this.shutdownTimeout = config.shutdownTimeout();
        this.hardTimeout = config.hardTimeout();
        this.reaperInterval = config.taskReaperInterval();
        this.taskReaper = config.reaperEnabled()
                ? new TaskReaper(queue, config.taskStuckThreshold(), inFlight::containsKey, this::report)
                : null;
    }

    /**
     * Start polling. No-op when disabled or already running.
     *
     * @throws IllegalStateException if the agent reports it is not ready
     */
    public synchronized void start() {
        if (!enabled) {
            log.warn("Scheduler is disabled");
            return;
        }
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        if (!agent.isReady()) {
            throw new IllegalStateException("Agent " + agent.name() + " is not ready");
        }

        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mailtask-scheduler");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger workerIds = new AtomicInteger();
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mailtask-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        running = true;
        draining = false;

        // First tick runs immediately
        long pollMs = Math.max(1L, pollInterval.toMillis());
        pollFuture = timer.scheduleWithFixedDelay(this::tick, 0, pollMs, TimeUnit.MILLISECONDS);

        if (taskReaper != null) {
            long reaperMs = Math.max(1L, reaperInterval.toMillis());
            reaperFuture = timer.scheduleAtFixedRate(taskReaper, reaperMs, reaperMs, TimeUnit.MILLISECONDS);
            log.info("Task reaper scheduled every {}ms", reaperMs);
        }

        log.info("Scheduler started (pollInterval={}ms, maxConcurrent={}, taskTimeout={}ms, hardTimeout={}, agent={})",
                pollMs, maxConcurrent, taskTimeout.toMillis(), hardTimeout, agent.name());
    }

    /**
     * Stop polling and wait for running attempts. Attempts still running after the
     * shutdown timeout have their tokens cancelled and are left to finish on their own.
     */
    public void stop() {
        synchronized (this) {
            if (!running || draining) {
                return;
            }
            // Taking pollLock waits out a pick in progress, so it is registered before the drain
            synchronized (pollLock) {
                draining = true;
            }
            pollFuture.cancel(false);
            if (reaperFuture != null) {
                reaperFuture.cancel(false);
            }
        }

        drain();

        synchronized (this) {
            timer.shutdownNow();
            workers.shutdown();
            running = false;
            draining = false;
        }

        try {
            agent.destroy();
        } catch (Exception e) {
            log.warn("Error destroying agent {}: {}", agent.name(), e.getMessage());
        }
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void drain() {
        if (inFlight.isEmpty()) {
            return;
        }
        log.info("Waiting for {} tasks to finish...", inFlight.size());

        long deadline = System.nanoTime() + shutdownTimeout.toNanos();
        while (!inFlight.isEmpty()) {
            if (System.nanoTime() - deadline >= 0) {
                log.warn("Graceful shutdown timed out; cancelling remaining tasks");
                cancelAll();
                return;
            }
            try {
                Thread.sleep(DRAIN_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining; cancelling remaining tasks");
                cancelAll();
                return;
            }
        }
        log.info("All tasks finished");
    }

    private void cancelAll() {
        inFlight.forEach((id, dispatch) -> {
            log.warn("Force-cancelling task: {}", id);
            try {
                dispatch.token.cancel("shutdown");
            } catch (RuntimeException e) {
                log.warn("Error cancelling task {}: {}", id, e.getMessage());
            }
        });
    }

    /**
     * Run one poll tick now. Ignored unless the scheduler is running.
     */
    public void triggerPoll() {
        if (!running) {
            log.warn("Scheduler is not running; cannot trigger poll");
            return;
        }
        tick();
    }

    private void tick() {
        try {
            poll();
        } catch (Exception e) {
            log.error("Error while polling tasks", e);
        }
    }

    private void poll() {
        synchronized (pollLock) {
            if (!running || draining) {
                return;
            }
            if (processingCount.get() >= maxConcurrent) {
                log.debug("Max concurrency reached ({}); skipping poll", maxConcurrent);
                return;
            }

            Optional<Task> picked = queue.pickTask();
            if (picked.isEmpty()) {
                return;
            }

            Dispatch dispatch = new Dispatch(picked.get());
            processingCount.incrementAndGet();
            inFlight.put(dispatch.task.id(), dispatch);
            log.debug("Current concurrency: {}/{}", processingCount.get(), maxConcurrent);

            try {
                dispatch.timeout = timer.schedule(() -> onTimeout(dispatch),
                        taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
                dispatch.worker = workers.submit(() -> execute(dispatch));
            } catch (RejectedExecutionException e) {
                log.error("Could not dispatch task {}", dispatch.task.id(), e);
                if (dispatch.settle()) {
                    release(dispatch);
                    recordFailure(dispatch.task, "Scheduler stopped before the task could run");
                }
            }
        }
    }

    private void execute(Dispatch dispatch) {
        Task task = dispatch.task;
        CancellationToken token = dispatch.token;
        log.info("Start processing task: {} (subject: {})", task.id(), task.subject());

        TaskResult result = null;
        Exception failure = null;
        try {
            queue.addTaskLog(task.id(), LogLevel.INFO, "Invoking agent (" + agent.name() + ")...");
            result = agent.processTask(task,
                    new ProcessOptions(token, taskTimeout, progress -> onProgress(dispatch, progress)));
        } catch (Exception e) {
            failure = e;
        }

        try {
            if (!dispatch.settle()) {
                log.debug("Discarding late outcome of task {}", task.id());
                return;
            }
            if (token.isCancelled() && (failure == null || failure instanceof TaskCancelledException)) {
                recordFailure(task, CANCELLED_MESSAGE);
            } else if (failure != null) {
                log.error("Task processing failed: {}", task.id(), failure);
                recordFailure(task, messageOf(failure));
            } else {
                recordSuccess(task, result, dispatch.elapsed());
            }
        } finally {
            release(dispatch);
        }
    }

    private void recordSuccess(Task task, TaskResult result, Duration elapsed) {
        try {
            queue.completeTask(task.id(), result);
        } catch (Exception e) {
            log.error("Failed to complete task {}", task.id(), e);
            recordFailure(task, messageOf(e));
            return;
        }
        try {
            queue.getTask(task.id()).ifPresent(this::report);
        } catch (Exception e) {
            log.warn("Failed to reload task {} for reporting: {}", task.id(), e.getMessage());
        }
        log.info("Task processed successfully: {} in {}ms", task.id(), elapsed.toMillis());
    }

    private void recordFailure(Task task, String error) {
        try {
            Optional<Task> updated = queue.failTask(task.id(), error);
            updated.filter(t -> t.status() == TaskStatus.FAILED).ifPresent(this::report);
        } catch (Exception e) {
            log.error("Failed to record failure of task {}", task.id(), e);
        }
    }

    private void report(Task task) {
        try {
            reporter.sendTaskReport(task);
        } catch (Exception e) {
            log.warn("Failed to send report for task {}: {}", task.id(), e.getMessage());
        }
    }

    private void onTimeout(Dispatch dispatch) {
        if (dispatch.isSettled()) {
            return;
        }
        log.warn("Task timed out: {} after {}ms", dispatch.task.id(), taskTimeout.toMillis());
        dispatch.token.cancel("timeout");

        if (!hardTimeout || !dispatch.settle()) {
            return;
        }
        release(dispatch);
        Future<?> worker = dispatch.worker;
        if (worker != null) {
            worker.cancel(true);
        }

        // Store I/O and reporting stay off the timer thread
        String error = "Task timed out after " + taskTimeout.toMillis() + "ms";
        try {
            workers.execute(() -> recordFailure(dispatch.task, error));
        } catch (RejectedExecutionException e) {
            recordFailure(dispatch.task, error);
        }
    }

    private void onProgress(Dispatch dispatch, AgentProgress progress) {
        if (progress == null || dispatch.isSettled()) {
            return;
        }
        try {
            queue.addTaskLog(dispatch.task.id(), LogLevel.DEBUG, progress.describe(),
                    Jsons.mapper().valueToTree(progress));
        } catch (Exception e) {
            log.warn("Failed to record progress of task {}: {}", dispatch.task.id(), e.getMessage());
        }
    }

    private void release(Dispatch dispatch) {
        if (!dispatch.released.compareAndSet(false, true)) {
            return;
        }
        ScheduledFuture<?> timeout = dispatch.timeout;
        if (timeout != null) {
            timeout.cancel(false);
        }
        inFlight.remove(dispatch.task.id(), dispatch);
        processingCount.decrementAndGet();
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isDraining() {
        return draining;
    }

    public int processingCount() {
        return processingCount.get();
    }

    /**
     * Get the task reaper, or null when stuck-task reaping is off.
     */
    public TaskReaper taskReaper() {
        return taskReaper;
    }

    public SchedulerStatus getStatus() {
        return new SchedulerStatus(
                running,
                draining,
                processingCount.get(),
                List.copyOf(inFlight.keySet()),
                pollInterval.toMillis(),
                maxConcurrent,
                taskTimeout.toMillis(),
                shutdownTimeout.toMillis(),
                hardTimeout,
                agent.name());
    }

    /** One attempt of one task. */
    private static final class Dispatch {
        final Task task;
        final CancellationToken token = new CancellationToken();
        final long startedNanos = System.nanoTime();
        final AtomicBoolean settled = new AtomicBoolean(false);
        final AtomicBoolean released = new AtomicBoolean(false);
        volatile Future<?> worker;
        volatile ScheduledFuture<?> timeout;

        Dispatch(Task task) {
            this.task = task;
        }

        /** Claim the right to record this attempt's outcome. */
        boolean settle() {
            return settled.compareAndSet(false, true);
        }

        boolean isSettled() {
            return settled.get();
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedNanos);
        }
    }
}
