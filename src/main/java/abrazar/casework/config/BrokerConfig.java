package abrazar.casework.config;

import abrazar.casework.broker.BrokerConnection;
import abrazar.casework.broker.RedissonBroker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

import java.util.Optional;

/**
 * Produces the shared {@link BrokerConnection} used by every queue, worker pool and the cache store.
 *
 * <p>
 * The broker is probed exactly once, when the connection bean is first created. A failed probe is logged and yields an
 * unavailable connection instead of failing startup, which switches queues and cache into their no-op behaviour for
 * the process lifetime.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code casework.broker.enabled} - set to false to force the degraded mode (default: true)</li>
 * <li>{@code casework.broker.url} - Redis address (default: redis://localhost:6379)</li>
 * <li>{@code casework.broker.password} - optional Redis password</li>
 * <li>{@code casework.broker.connect-timeout-ms} - connect timeout (default: 3000)</li>
 * <li>{@code casework.broker.command-timeout-ms} - per-command timeout (default: 3000)</li>
 * <li>{@code casework.broker.retry-attempts} - command retries inside the client (default: 1)</li>
 * </ul>
 */
@ApplicationScoped
public class BrokerConfig {

    private static final Logger LOG = Logger.getLogger(BrokerConfig.class);

    @ConfigProperty(
            name = "casework.broker.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "casework.broker.url",
            defaultValue = "redis://localhost:6379")
    String url;

    @ConfigProperty(
            name = "casework.broker.password")
    Optional<String> password;

    @ConfigProperty(
            name = "casework.broker.connect-timeout-ms",
            defaultValue = "3000")
    int connectTimeoutMs;

    @ConfigProperty(
            name = "casework.broker.command-timeout-ms",
            defaultValue = "3000")
    int commandTimeoutMs;

    @ConfigProperty(
            name = "casework.broker.retry-attempts",
            defaultValue = "1")
    int retryAttempts;

    @Produces
    @Singleton
    public BrokerConnection brokerConnection() {
        if (!enabled) {
            LOG.warn("Broker disabled by configuration; queues and cache run in no-op mode");
            return BrokerConnection.unavailable("disabled by configuration");
        }

        RedissonClient client;
        try {
            client = Redisson.create(redissonConfig());
        } catch (RuntimeException e) {
            LOG.warnf("Broker unreachable at %s (%s); queues and cache run in no-op mode", url, e.getMessage());
            return BrokerConnection.unavailable(e.getMessage());
        }

        RedissonBroker broker = new RedissonBroker(client);
        if (!broker.ping()) {
            client.shutdown();
            LOG.warnf("Broker at %s did not answer PING; queues and cache run in no-op mode", url);
            return BrokerConnection.unavailable("ping failed");
        }

        LOG.infof("Connected to broker at %s", url);
        return BrokerConnection.available(broker, client::shutdown);
    }

    void closeBrokerConnection(@Disposes BrokerConnection connection) {
        connection.close();
        LOG.info("Broker connection closed");
    }

    Config redissonConfig() {
        Config config = new Config();
        var server = config.useSingleServer().setAddress(url).setConnectTimeout(connectTimeoutMs)
                .setTimeout(commandTimeoutMs).setRetryAttempts(retryAttempts);
        password.filter(p -> !p.isBlank()).ifPresent(server::setPassword);
        return config;
    }
}
