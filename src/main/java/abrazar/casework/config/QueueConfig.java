package abrazar.casework.config;

import abrazar.casework.jobs.BackoffPolicy;
import abrazar.casework.jobs.QueueName;
import abrazar.casework.jobs.QueueOptions;
import abrazar.casework.jobs.RetentionPolicy;
import abrazar.casework.jobs.WorkerOptions;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * Queue and worker settings.
 *
 * <p>
 * <b>Queue defaults</b> (shared by all four queues):
 * <ul>
 * <li>{@code casework.queues.attempts} - attempts per job (default: 3)</li>
 * <li>{@code casework.queues.backoff-delay-ms} - exponential backoff base (default: 2000)</li>
 * <li>{@code casework.queues.completed-max-age-hours} / {@code completed-max-count} - completed retention (default:
 * 24 / 1000)</li>
 * <li>{@code casework.queues.failed-max-age-days} - failed retention (default: 7)</li>
 * <li>{@code casework.queues.stalled-timeout-minutes} - stalled claim threshold (default: 10)</li>
 * </ul>
 *
 * <p>
 * <b>Per-queue worker overrides</b> under {@code casework.workers.<queue-key>.}: {@code concurrency},
 * {@code rate-limit-max}, {@code rate-limit-window-seconds}, {@code job-timeout-seconds} (0 disables the deadline),
 * {@code poll-interval-ms}. Unset keys fall back to the {@link QueueName} defaults.
 */
@ApplicationScoped
public class QueueConfig {

    @ConfigProperty(
            name = "casework.queues.attempts",
            defaultValue = "3")
    int attempts;

    @ConfigProperty(
            name = "casework.queues.backoff-delay-ms",
            defaultValue = "2000")
    long backoffDelayMs;

    @ConfigProperty(
            name = "casework.queues.completed-max-age-hours",
            defaultValue = "24")
    long completedMaxAgeHours;

    @ConfigProperty(
            name = "casework.queues.completed-max-count",
            defaultValue = "1000")
    int completedMaxCount;

    @ConfigProperty(
            name = "casework.queues.failed-max-age-days",
            defaultValue = "7")
    long failedMaxAgeDays;

    @ConfigProperty(
            name = "casework.queues.stalled-timeout-minutes",
            defaultValue = "10")
    long stalledTimeoutMinutes;

    @ConfigProperty(
            name = "casework.workers.job-timeout-seconds",
            defaultValue = "300")
    long defaultJobTimeoutSeconds;

    @ConfigProperty(
            name = "casework.workers.shutdown-grace-seconds",
            defaultValue = "30")
    long shutdownGraceSeconds;

    @Inject
    Config config;

    public QueueOptions queueOptions() {
        return new QueueOptions(Math.max(1, attempts), BackoffPolicy.exponential(Duration.ofMillis(backoffDelayMs)),
                new RetentionPolicy(Duration.ofHours(completedMaxAgeHours), completedMaxCount,
                        Duration.ofDays(failedMaxAgeDays)),
                Duration.ofMinutes(stalledTimeoutMinutes));
    }

    public WorkerOptions workerOptions(QueueName queue) {
        String prefix = "casework.workers." + queue.getKey() + ".";
        int concurrency = config.getOptionalValue(prefix + "concurrency", Integer.class)
                .orElse(queue.getDefaultConcurrency());
        int rateLimitMax = config.getOptionalValue(prefix + "rate-limit-max", Integer.class)
                .orElse(queue.getDefaultRateLimitMax());
        long windowSeconds = config.getOptionalValue(prefix + "rate-limit-window-seconds", Long.class).orElse(60L);
        long timeoutSeconds = config.getOptionalValue(prefix + "job-timeout-seconds", Long.class)
                .orElse(defaultJobTimeoutSeconds);
        long pollIntervalMs = config.getOptionalValue(prefix + "poll-interval-ms", Long.class).orElse(1000L);

        return new WorkerOptions(concurrency, rateLimitMax, Duration.ofSeconds(windowSeconds),
                Duration.ofSeconds(timeoutSeconds), Duration.ofMillis(pollIntervalMs),
                Duration.ofMinutes(stalledTimeoutMinutes), Duration.ofSeconds(shutdownGraceSeconds));
    }
}
