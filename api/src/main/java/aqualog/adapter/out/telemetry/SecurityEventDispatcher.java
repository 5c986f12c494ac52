package aqualog.adapter.out.telemetry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import aqualog.config.TelemetryConfigMapping;
import aqualog.spi.SecurityEvent;
import aqualog.spi.SecurityEventHandler;

/**
 * Fans security events out to the registered {@link SecurityEventHandler}s.
 *
 * <p>Handlers are CDI beans, plus any external handlers registered through
 * {@link ServiceLoader} under a name no bean already uses. They run in priority
 * order (highest first) on one background thread fed by a bounded queue. When
 * the queue is full the event is dropped and counted in
 * {@code aqualog.security.events.dropped}; a login never waits on a handler.
 *
 * <p>Nothing is dispatched while security monitoring is disabled.
 */
@ApplicationScoped
public class SecurityEventDispatcher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    static final int QUEUE_CAPACITY = 1024;

    private final boolean enabled;
    private final List<SecurityEventHandler> handlers;
    private final Counter droppedEvents;
    private final int queueCapacity;

    private ThreadPoolExecutor executor;

    @Inject
    public SecurityEventDispatcher(
            TelemetryConfigMapping config, MeterRegistry meterRegistry, @Any Instance<SecurityEventHandler> beans) {
        this(
                isEnabled(config),
                isEnabled(config) ? merge(beans.stream().toList(), loadExternalHandlers()) : List.of(),
                meterRegistry,
                QUEUE_CAPACITY);
    }

    SecurityEventDispatcher(
            boolean enabled, List<SecurityEventHandler> candidates, MeterRegistry meterRegistry, int queueCapacity) {
        this.enabled = enabled;
        this.handlers = enabled
                ? candidates.stream()
                        .filter(SecurityEventHandler::isAvailable)
                        .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                        .toList()
                : List.of();
        this.droppedEvents = Counter.builder("aqualog.security.events.dropped")
                .description("Security events dropped because the dispatch queue was full")
                .register(meterRegistry);
        this.queueCapacity = queueCapacity;
    }

    private static boolean isEnabled(TelemetryConfigMapping config) {
        return config != null && config.enabled() && config.security().enabled();
    }

    private static List<SecurityEventHandler> loadExternalHandlers() {
        return ServiceLoader.load(SecurityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    /**
     * Combine bean handlers with external ones. An external handler whose name
     * is already taken is skipped.
     */
    static List<SecurityEventHandler> merge(List<SecurityEventHandler> beans, List<SecurityEventHandler> external) {
        final List<SecurityEventHandler> merged = new ArrayList<>(beans);
        final Set<String> names = new HashSet<>();
        beans.forEach(handler -> names.add(handler.name()));
        for (var handler : external) {
            if (names.add(handler.name())) {
                merged.add(handler);
            } else {
                LOG.warnf("Ignoring external security event handler %s: name already registered", handler.name());
            }
        }
        return merged;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Security monitoring is disabled - event dispatcher inactive");
            return;
        }
        if (handlers.isEmpty()) {
            LOG.warn("No security event handlers available - events will not be processed");
            return;
        }

        LOG.infof(
                "Dispatching security events to: %s",
                handlers.stream().map(h -> h.name() + "(priority=" + h.priority() + ")").toList());

        executor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    final var thread = new Thread(r, "security-event-dispatcher");
                    thread.setDaemon(true);
                    return thread;
                },
                (task, pool) -> droppedEvents.increment());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        for (var handler : handlers) {
            try {
                handler.close();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Error closing security event handler %s", handler.name());
            }
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Queue an event for every handler. Returns immediately.
     *
     * @param event the event to dispatch
     */
    public void dispatch(SecurityEvent event) {
        if (executor == null) {
            return;
        }
        executor.execute(() -> deliver(event));
    }

    private void deliver(SecurityEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf(
                        e, "Security event handler %s failed on %s", handler.name(), event.getClass().getSimpleName());
            }
        }
    }

    /**
     * Handlers in invocation order; empty while disabled.
     */
    public List<SecurityEventHandler> getHandlers() {
        return handlers;
    }
}
