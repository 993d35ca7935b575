package abrazar.casework.jobs;

import java.time.Duration;

/**
 * Runtime settings of one worker pool.
 *
 * @param concurrency
 *            jobs of this queue running at once
 * @param rateLimitMax
 *            job starts allowed per {@code rateLimitWindow}; non-positive disables the limiter
 * @param rateLimitWindow
 *            rolling window of the rate limiter
 * @param jobTimeout
 *            per-job deadline; {@link Duration#ZERO} disables it
 * @param pollInterval
 *            wait between claims while the queue is empty
 * @param stalledTimeout
 *            age of an ACTIVE claim after which the job is recovered
 * @param shutdownGrace
 *            how long {@code stop()} waits for running jobs
 */
public record WorkerOptions(int concurrency, int rateLimitMax, Duration rateLimitWindow, Duration jobTimeout,
        Duration pollInterval, Duration stalledTimeout, Duration shutdownGrace) {

    public WorkerOptions {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
        }
    }

    public static WorkerOptions defaults(QueueName queue) {
        return new WorkerOptions(queue.getDefaultConcurrency(), queue.getDefaultRateLimitMax(), Duration.ofSeconds(60),
                Duration.ofMinutes(5), Duration.ofSeconds(1), Duration.ofMinutes(10), Duration.ofSeconds(30));
    }

    public WorkerOptions withConcurrency(int value) {
        return new WorkerOptions(value, rateLimitMax, rateLimitWindow, jobTimeout, pollInterval, stalledTimeout,
                shutdownGrace);
    }

    public WorkerOptions withRateLimit(int max, Duration window) {
        return new WorkerOptions(concurrency, max, window, jobTimeout, pollInterval, stalledTimeout, shutdownGrace);
    }

    public WorkerOptions withJobTimeout(Duration value) {
        return new WorkerOptions(concurrency, rateLimitMax, rateLimitWindow, value, pollInterval, stalledTimeout,
                shutdownGrace);
    }

    public WorkerOptions withPollInterval(Duration value) {
        return new WorkerOptions(concurrency, rateLimitMax, rateLimitWindow, jobTimeout, value, stalledTimeout,
                shutdownGrace);
    }
}
