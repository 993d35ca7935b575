package abrazar.casework.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter on job starts for one worker pool.
 *
 * <p>
 * Keeps the start timestamps of the current window. The pool asks {@link #timeUntilNextStart()} before claiming and
 * waits that long, then records the start once a job was actually claimed, so an empty poll never consumes budget.
 */
public class JobStartRateLimiter {

    private final int maxStarts;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> starts = new ArrayDeque<>();

    public JobStartRateLimiter(int maxStarts, Duration window, Clock clock) {
        this.maxStarts = maxStarts;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Returns how long to wait before another job may start; zero when a start is allowed now.
     */
    public synchronized Duration timeUntilNextStart() {
        if (maxStarts <= 0) {
            return Duration.ZERO;
        }
        Instant now = clock.instant();
        prune(now);
        if (starts.size() < maxStarts) {
            return Duration.ZERO;
        }
        Duration wait = Duration.between(now, starts.peekFirst().plus(window));
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    public synchronized void recordStart() {
        if (maxStarts > 0) {
            starts.addLast(clock.instant());
        }
    }

    /**
     * Starts within the current window.
     */
    public synchronized int startsInWindow() {
        prune(clock.instant());
        return starts.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!starts.isEmpty() && !starts.peekFirst().isAfter(cutoff)) {
            starts.removeFirst();
        }
    }
}
