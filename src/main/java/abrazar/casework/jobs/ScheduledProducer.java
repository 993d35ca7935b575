package abrazar.casework.jobs;

import io.quarkus.scheduler.Scheduled.ConcurrentExecution;
import io.quarkus.scheduler.Scheduler;
import io.quarkus.scheduler.Trigger;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Base class for cron-driven job producers.
 *
 * <p>
 * Each producer registers one programmatic Quarkus scheduler job, identified by {@code casework-{name}}, with its cron
 * expression and time zone. Overlapping firings are skipped rather than queued.
 *
 * <p>
 * <b>Error boundary:</b> an exception thrown by {@link #fire()} is caught and logged by {@link #fireOnce()}; the next
 * firing still happens.
 *
 * <p>
 * {@link #start()} and {@link #stop()} are idempotent.
 */
public abstract class ScheduledProducer {

    private static final Logger LOG = Logger.getLogger(ScheduledProducer.class);

    @Inject
    Scheduler scheduler;

    private boolean running;
    private Trigger trigger;
    private volatile Instant lastFiredAt;

    protected Clock clock = Clock.systemUTC();

    /**
     * Short producer name used for logs and the scheduler job identity.
     */
    protected abstract String name();

    /**
     * Quartz-style cron expression (seconds first), e.g. {@code 0 0/30 * * * ?}.
     */
    protected abstract String cronExpression();

    protected abstract ZoneId zone();

    /**
     * Runs one firing.
     */
    protected abstract void fire() throws Exception;

    public String identity() {
        return "casework-" + name();
    }

    /**
     * Registers the scheduler job.
     *
     * @return false when already running
     * @throws IllegalArgumentException
     *             if the scheduler rejects the cron expression or zone
     */
    public synchronized boolean start() {
        if (running) {
            return false;
        }
        try {
            trigger = scheduler.newJob(identity())
                    .setCron(cronExpression())
                    .setTimeZone(zone().getId())
                    .setConcurrentExecution(ConcurrentExecution.SKIP)
                    .setTask(execution -> fireOnce())
                    .schedule();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new IllegalArgumentException(
                    "Cannot schedule producer " + name() + " with cron '" + cronExpression() + "'", e);
        }
        running = true;
        LOG.infof("Producer %s started (cron: %s, zone: %s, next: %s)", name(), cronExpression(), zone(),
                nextFireAt().orElse(null));
        return true;
    }

    /**
     * Removes the scheduler job. A firing in progress runs to completion.
     *
     * @return false when not running
     */
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        trigger = null;
        if (scheduler.unscheduleJob(identity()) == null) {
            LOG.warnf("Producer %s had no scheduler job to remove", name());
        }
        LOG.infof("Producer %s stopped", name());
        return true;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Runs {@link #fire()} once inside the error boundary.
     *
     * @return true when the firing completed without error
     */
    public boolean fireOnce() {
        Instant startedAt = clock.instant();
        try {
            fire();
            LOG.debugf("Producer %s fired in %d ms", name(), Duration.between(startedAt, clock.instant()).toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Producer %s interrupted during firing", name());
            return false;
        } catch (Exception e) {
            LOG.errorf(e, "Producer %s firing failed; next firing still scheduled", name());
            return false;
        } finally {
            lastFiredAt = startedAt;
        }
    }

    public Optional<Instant> lastFiredAt() {
        return Optional.ofNullable(lastFiredAt);
    }

    public synchronized Optional<Instant> nextFireAt() {
        return trigger == null ? Optional.empty() : Optional.ofNullable(trigger.getNextFireTime());
    }
}
