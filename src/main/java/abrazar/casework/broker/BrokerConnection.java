package abrazar.casework.broker;

import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Result of the one-time broker reachability probe performed at startup.
 *
 * <p>
 * The outcome is fixed for the process lifetime: queues and the cache read {@link #isAvailable()} once when they are
 * created and select the live or the disabled behaviour accordingly. Callers of those components never check broker
 * status themselves.
 */
public class BrokerConnection {

    private static final Logger LOG = Logger.getLogger(BrokerConnection.class);

    private final Broker broker;
    private final String unavailableReason;
    private final Runnable closeAction;

    private BrokerConnection(Broker broker, String unavailableReason, Runnable closeAction) {
        this.broker = broker;
        this.unavailableReason = unavailableReason;
        this.closeAction = closeAction;
    }

    public static BrokerConnection available(Broker broker) {
        return available(broker, () -> {
        });
    }

    public static BrokerConnection available(Broker broker, Runnable closeAction) {
        return new BrokerConnection(broker, null, closeAction);
    }

    public static BrokerConnection unavailable(String reason) {
        return new BrokerConnection(null, reason, () -> {
        });
    }

    public boolean isAvailable() {
        return broker != null;
    }

    public Optional<Broker> broker() {
        return Optional.ofNullable(broker);
    }

    public Optional<String> unavailableReason() {
        return Optional.ofNullable(unavailableReason);
    }

    /**
     * Releases the underlying client. Safe to call more than once and on an unavailable connection.
     */
    public void close() {
        if (broker == null) {
            return;
        }
        try {
            closeAction.run();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to close broker connection cleanly");
        }
    }
}
