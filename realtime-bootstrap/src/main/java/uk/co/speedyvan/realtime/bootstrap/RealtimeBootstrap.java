package uk.co.speedyvan.realtime.bootstrap;

import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.co.speedyvan.realtime.api.RealtimeClient;
import uk.co.speedyvan.realtime.api.transport.TransportSession;
import uk.co.speedyvan.realtime.bootstrap.config.EndpointYamlConfig;
import uk.co.speedyvan.realtime.bootstrap.config.RealtimeConfig;
import uk.co.speedyvan.realtime.bootstrap.config.RedisYamlConfig;
import uk.co.speedyvan.realtime.bootstrap.lifecycle.CloseableRegistry;
import uk.co.speedyvan.realtime.core.RealtimeManager;
import uk.co.speedyvan.realtime.core.RealtimeSettings;
import uk.co.speedyvan.realtime.core.RealtimeSubscriptions;
import uk.co.speedyvan.realtime.core.codec.PayloadCodec;
import uk.co.speedyvan.realtime.core.diagnostics.Slf4jDiagnosticsSink;
import uk.co.speedyvan.realtime.core.polling.OkHttpPollClient;
import uk.co.speedyvan.realtime.core.schedule.ExecutorTaskScheduler;
import uk.co.speedyvan.realtime.core.transport.LettuceTransportSession;
import uk.co.speedyvan.realtime.core.transport.OkHttpChannelAuthorizer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Composition root: builds one {@link RealtimeManager} and everything it depends on from {@link RealtimeConfig},
 * and shuts it all down in reverse order.
 * <p>
 * Applications hold on to the bootstrap (or the {@link RealtimeClient} it exposes) instead of reaching for a
 * process-wide singleton.
 */
public final class RealtimeBootstrap implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RealtimeBootstrap.class);

    private final RealtimeConfig config;
    private final CloseableRegistry closeables = new CloseableRegistry();

    private RealtimeManager manager;
    private RealtimeSubscriptions subscriptions;
    private boolean started;

    public RealtimeBootstrap(RealtimeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static RealtimeBootstrap fromFile(Path configFile) {
        return new RealtimeBootstrap(RealtimeConfig.load(configFile, RealtimeBootstrap.class.getClassLoader()));
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        try {
            this.manager = createManager();
            manager.initialize();
            this.subscriptions = new RealtimeSubscriptions(manager);
            started = true;
            LOGGER.info("Realtime bootstrap completed (redis {}, public session {})",
                    config.redis(), config.publicRedis().isPresent() ? "enabled" : "disabled");
        } catch (RuntimeException e) {
            LOGGER.error("Failed to start realtime client", e);
            closeables.closeAllQuietly();
            manager = null;
            throw e;
        }
    }

    public synchronized void stop() {
        boolean wasStarted = started;
        started = false;
        int failures = closeables.closeAllQuietly();
        if (wasStarted) {
            LOGGER.info("Realtime client stopped ({} resource(s) failed to close)", failures);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public synchronized RealtimeClient client() {
        requireStarted();
        return manager;
    }

    public synchronized RealtimeManager manager() {
        requireStarted();
        return manager;
    }

    public synchronized RealtimeSubscriptions subscriptions() {
        requireStarted();
        return subscriptions;
    }

    RealtimeManager createManager() {
        RealtimeSettings settings = config.client().toSettings();
        EndpointYamlConfig endpoints = config.endpoints();
        PayloadCodec codec = new PayloadCodec();

        OkHttpClient http = new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(endpoints.authTimeoutMs()))
                .retryOnConnectionFailure(true)
                .build();
        closeables.register(() -> {
            http.dispatcher().executorService().shutdown();
            http.connectionPool().evictAll();
        });

        ExecutorTaskScheduler scheduler = closeables.register(new ExecutorTaskScheduler("realtime-scheduler-"));

        OkHttpChannelAuthorizer authorizer = new OkHttpChannelAuthorizer(http, endpoints.authUrl(), endpoints.accessToken(), codec);
        // Redis callbacks are handed to the scheduler thread, never run on the Lettuce event loop
        TransportSession privateSession = new LettuceTransportSession("private", config.redis().toClientFactory(),
                authorizer, codec, scheduler);
        TransportSession publicSession = config.publicRedis()
                .map(RedisYamlConfig::toClientFactory)
                .map(factory -> (TransportSession) new LettuceTransportSession("public", factory, codec, scheduler))
                .orElse(null);

        OkHttpPollClient pollClient = new OkHttpPollClient(http, endpoints.pollUrl(), endpoints.accessToken(),
                settings.pollRequestTimeout(), codec);

        RealtimeManager created = RealtimeManager.builder()
                .transport(privateSession)
                .publicTransport(publicSession)
                .pollClient(pollClient)
                .scheduler(scheduler)
                .settings(settings)
                .diagnostics(new Slf4jDiagnosticsSink(settings.transportFailureLogInterval()))
                .codec(codec)
                .build();
        closeables.register(created::disconnect);
        return created;
    }

    private void requireStarted() {
        if (!started) {
            throw new IllegalStateException("Realtime bootstrap has not been started");
        }
    }
}
