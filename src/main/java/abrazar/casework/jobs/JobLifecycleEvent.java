package abrazar.casework.jobs;

import java.time.Duration;

/**
 * CDI event fired by worker pools around every job attempt.
 *
 * <p>
 * Observed by {@link abrazar.casework.observability.ObservabilityMetrics} for job counters and timers.
 *
 * @param duration
 *            elapsed handler time; {@link Duration#ZERO} for {@link Stage#STARTED}
 * @param error
 *            failure message for {@link Stage#RETRY_SCHEDULED} and {@link Stage#FAILED}
 */
public record JobLifecycleEvent(QueueName queue, String jobId, String jobType, String tenantId, Stage stage,
        int attempt, Duration duration, String error) {

    public enum Stage {
        STARTED, COMPLETED, RETRY_SCHEDULED, FAILED
    }
}
