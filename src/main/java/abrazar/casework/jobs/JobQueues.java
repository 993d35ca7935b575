package abrazar.casework.jobs;

import abrazar.casework.broker.BrokerConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Selects the queue implementation once, from the startup broker probe.
 */
public final class JobQueues {

    private static final Logger LOG = Logger.getLogger(JobQueues.class);

    private JobQueues() {
    }

    public static JobQueue create(QueueName name, QueueOptions options, BrokerConnection connection,
            ObjectMapper objectMapper, Clock clock) {
        if (connection.broker().isEmpty()) {
            LOG.warnf("Queue %s created in disabled mode: %s", name.getKey(),
                    connection.unavailableReason().orElse("broker unavailable"));
            return new DisabledJobQueue(name);
        }
        LOG.debugf("Queue %s created (attempts: %d, backoff: %s)", name.getKey(), options.maxAttempts(),
                options.backoff());
        return new LiveJobQueue(name, options, connection.broker().get(), objectMapper, clock);
    }
}
