package abrazar.casework.jobs;

import abrazar.casework.exceptions.PermanentJobFailureException;
import abrazar.casework.observability.LoggingConfig;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Concurrency-bounded, rate-limited consumer bound to exactly one {@link JobQueue}.
 *
 * <p>
 * A single dispatcher thread claims jobs and hands them to a fixed pool of {@code concurrency} worker threads. Before
 * each claim it needs a free slot (semaphore with {@code concurrency} permits) and an allowed start from the
 * {@link JobStartRateLimiter}; both limits hold at the same time. When the queue is empty the dispatcher sleeps for the
 * poll interval.
 *
 * <p>
 * Each job runs inside a {@code job.execute} span with job MDC fields and is dispatched by {@code jobType} into the
 * dispatch table:
 * <ul>
 * <li>handler returns - COMPLETED, the return value is only logged</li>
 * <li>{@link PermanentJobFailureException} or unknown job type - FAILED immediately</li>
 * <li>any other exception (including the deadline expiring) - retried with backoff until attempts are exhausted</li>
 * </ul>
 *
 * <p>
 * {@link #stop()} is idempotent and safe to call before {@link #start()}.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class);

    private static final Duration STALL_CHECK_INTERVAL = Duration.ofSeconds(30);

    private final JobQueue queue;
    private final WorkerOptions options;
    private final Map<String, JobHandler> dispatchTable;
    private final Consumer<JobLifecycleEvent> lifecycleListener;
    private final Tracer tracer;
    private final Clock clock;

    private final Semaphore slots;
    private final JobStartRateLimiter rateLimiter;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ScheduledExecutorService deadlines;

    private ExecutorService workers;
    private Thread dispatcher;
    private long lastStallCheckMillis;

    public WorkerPool(JobQueue queue, WorkerOptions options, Map<String, JobHandler> dispatchTable,
            Consumer<JobLifecycleEvent> lifecycleListener, Tracer tracer, Clock clock) {
        this.queue = queue;
        this.options = options;
        this.dispatchTable = Map.copyOf(dispatchTable);
        this.lifecycleListener = lifecycleListener;
        this.tracer = tracer;
        this.clock = clock;
        this.slots = new Semaphore(options.concurrency());
        this.rateLimiter = new JobStartRateLimiter(options.rateLimitMax(), options.rateLimitWindow(), clock);
        this.deadlines = Executors
                .newSingleThreadScheduledExecutor(threadFactory("worker-" + queue.name().getKey() + "-deadline"));
    }

    public QueueName queueName() {
        return queue.name();
    }

    public WorkerOptions options() {
        return options;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns the number of jobs currently executing.
     */
    public int activeJobs() {
        return options.concurrency() - slots.availablePermits();
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        String prefix = "worker-" + queue.name().getKey();
        workers = Executors.newFixedThreadPool(options.concurrency(), threadFactory(prefix));
        dispatcher = new Thread(this::dispatchLoop, prefix + "-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();

        LOG.infof("Worker pool %s started (concurrency: %d, rate limit: %d per %ds, job types: %s)",
                queue.name().getKey(), options.concurrency(), options.rateLimitMax(),
                options.rateLimitWindow().toSeconds(), dispatchTable.keySet());
    }

    /**
     * Stops claiming, waits up to the shutdown grace period for running jobs, then interrupts the rest. Jobs still
     * ACTIVE afterwards are recovered as stalled by the next process.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        long graceMillis = options.shutdownGrace().toMillis();
        try {
            dispatcher.interrupt();
            dispatcher.join(graceMillis);

            workers.shutdown();
            if (!workers.awaitTermination(graceMillis, TimeUnit.MILLISECONDS)) {
                LOG.warnf("Worker pool %s did not finish %d running jobs within %d ms; interrupting",
                        queue.name().getKey(), activeJobs(), graceMillis);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }

        LOG.infof("Worker pool %s stopped", queue.name().getKey());
    }

    /**
     * Stops the pool and releases the deadline timer. The pool cannot be used afterwards.
     */
    @Override
    public void close() {
        stop();
        deadlines.shutdownNow();
    }

    /**
     * Claims one job and runs it on the calling thread. Bypasses the rate limiter.
     *
     * @return the run result, or empty when no job was waiting
     */
    public Optional<JobRunResult> processNext() {
        return queue.claim().map(this::process);
    }

    /**
     * Runs one claimed job and records its outcome on the queue.
     */
    public JobRunResult process(QueuedJob job) {
        int attempt = job.currentAttempt();
        long startNanos = System.nanoTime();

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id())
                .setAttribute("job.type", job.jobType()).setAttribute("job.queue", queue.name().getKey())
                .setAttribute("job.attempt", attempt).startSpan();

        publish(job, JobLifecycleEvent.Stage.STARTED, Duration.ZERO, null);

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobContext(job);

            JobHandler handler = dispatchTable.get(job.jobType());
            if (handler == null) {
                throw new PermanentJobFailureException(
                        "No handler registered for job type " + job.jobType() + " on queue " + queue.name().getKey());
            }

            Object value = executeWithDeadline(handler, job);
            queue.complete(job);

            Duration elapsed = elapsedSince(startNanos);
            span.addEvent("job.completed");
            LOG.infof("Job %s (type: %s) completed on attempt %d in %d ms, result: %s", job.id(), job.jobType(),
                    attempt, elapsed.toMillis(), value);
            publish(job, JobLifecycleEvent.Stage.COMPLETED, elapsed, null);
            return new JobRunResult(job.id(), job.jobType(), queue.name(), JobRunResult.Outcome.COMPLETED, attempt,
                    value, null, elapsed);

        } catch (PermanentJobFailureException e) {
            return recordFailure(job, span, startNanos, e, true);

        } catch (InterruptedException e) {
            JobRunResult result = recordFailure(job, span, startNanos, e, false);
            Thread.currentThread().interrupt();
            return result;

        } catch (Exception e) {
            return recordFailure(job, span, startNanos, e, false);

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private JobRunResult recordFailure(QueuedJob job, Span span, long startNanos, Exception e, boolean permanent) {
        int attempt = job.currentAttempt();
        String error = e.getClass().getSimpleName() + ": " + e.getMessage();

        span.recordException(e);
        span.setStatus(StatusCode.ERROR, error);
        span.addEvent(permanent ? "job.failed.permanent" : "job.failed");

        JobState state = queue.fail(job, error, permanent);
        Duration elapsed = elapsedSince(startNanos);

        if (state == JobState.DELAYED) {
            LOG.warnf(e, "Job %s (type: %s) failed on attempt %d/%d; retry scheduled", job.id(), job.jobType(),
                    attempt, job.maxAttempts());
            publish(job, JobLifecycleEvent.Stage.RETRY_SCHEDULED, elapsed, error);
            return new JobRunResult(job.id(), job.jobType(), queue.name(), JobRunResult.Outcome.RETRY_SCHEDULED,
                    attempt, null, error, elapsed);
        }

        if (permanent) {
            LOG.errorf(e, "Job %s (type: %s) failed permanently on attempt %d, payload: %s", job.id(), job.jobType(),
                    attempt, job.payload());
        } else {
            LOG.errorf(e, "Job %s (type: %s) failed after %d attempts, payload: %s", job.id(), job.jobType(), attempt,
                    job.payload());
        }
        publish(job, JobLifecycleEvent.Stage.FAILED, elapsed, error);
        return new JobRunResult(job.id(), job.jobType(), queue.name(), JobRunResult.Outcome.FAILED, attempt, null,
                error, elapsed);
    }

    private Object executeWithDeadline(JobHandler handler, QueuedJob job) throws Exception {
        Duration timeout = options.jobTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return handler.execute(job.id(), job.payload());
        }

        Thread worker = Thread.currentThread();
        Deadline deadline = new Deadline();
        ScheduledFuture<?> watchdog = deadlines.schedule(() -> deadline.expire(worker), timeout.toMillis(),
                TimeUnit.MILLISECONDS);
        try {
            return handler.execute(job.id(), job.payload());
        } catch (Exception e) {
            if (deadline.isExpired()) {
                TimeoutException timeoutException = new TimeoutException(
                        "Job " + job.id() + " exceeded its deadline of " + timeout.toMillis() + " ms");
                timeoutException.initCause(e);
                throw timeoutException;
            }
            throw e;
        } finally {
            deadline.finish();
            watchdog.cancel(false);
            if (deadline.isExpired()) {
                // clear the watchdog interrupt before the thread is reused
                Thread.interrupted();
            }
        }
    }

    private void dispatchLoop() {
        while (running.get()) {
            boolean claimed;
            try {
                claimed = dispatchOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Worker pool %s dispatch error", queue.name().getKey());
                claimed = false;
            }

            if (!claimed && !pause(options.pollInterval())) {
                break;
            }
        }
        LOG.debugf("Worker pool %s dispatcher exited", queue.name().getKey());
    }

    private boolean dispatchOnce() throws InterruptedException {
        slots.acquire();
        boolean handedOff = false;
        try {
            Duration wait = rateLimiter.timeUntilNextStart();
            while (!wait.isZero()) {
                LOG.debugf("Worker pool %s rate limited; waiting %d ms", queue.name().getKey(), wait.toMillis());
                Thread.sleep(wait.toMillis());
                wait = rateLimiter.timeUntilNextStart();
            }

            recoverStalledIfDue();

            Optional<QueuedJob> next = queue.claim();
            if (next.isEmpty()) {
                return false;
            }

            rateLimiter.recordStart();
            QueuedJob job = next.get();
            try {
                workers.execute(() -> {
                    try {
                        process(job);
                    } finally {
                        slots.release();
                    }
                });
                handedOff = true;
            } catch (RejectedExecutionException e) {
                LOG.warnf("Worker pool %s is shutting down; job %s stays active until stall recovery",
                        queue.name().getKey(), job.id());
            }
            return handedOff;
        } finally {
            if (!handedOff) {
                slots.release();
            }
        }
    }

    private void recoverStalledIfDue() {
        long now = clock.millis();
        if (now - lastStallCheckMillis < STALL_CHECK_INTERVAL.toMillis()) {
            return;
        }
        lastStallCheckMillis = now;
        int recovered = queue.recoverStalled(options.stalledTimeout());
        if (recovered > 0) {
            LOG.warnf("Worker pool %s recovered %d stalled jobs", queue.name().getKey(), recovered);
        }
    }

    private boolean pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void publish(QueuedJob job, JobLifecycleEvent.Stage stage, Duration duration, String error) {
        try {
            lifecycleListener.accept(new JobLifecycleEvent(queue.name(), job.id(), job.jobType(), job.tenantId(),
                    stage, job.currentAttempt(), duration, error));
        } catch (RuntimeException e) {
            LOG.warnf(e, "Lifecycle listener failed for job %s (%s)", job.id(), stage);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Per-execution deadline state. Both transitions happen under the monitor so no interrupt lands after
     * {@link #finish()}.
     */
    private static final class Deadline {
        private boolean finished;
        private boolean expired;

        synchronized void expire(Thread worker) {
            if (!finished) {
                expired = true;
                worker.interrupt();
            }
        }

        synchronized void finish() {
            finished = true;
        }

        synchronized boolean isExpired() {
            return expired;
        }
    }
}
