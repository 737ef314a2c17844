package stockgate.adapter.out.telemetry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import stockgate.config.TelemetryConfigMapping;
import stockgate.spi.SecurityEvent;
import stockgate.spi.SecurityEventHandler;

/**
 * Hands security events to the registered handlers off the request path.
 *
 * <p>Handlers come from two places: CDI beans implementing
 * {@link SecurityEventHandler} (the built-in logging and metrics handlers) and
 * plug-ins listed under {@code META-INF/services}. A bean wins over a plug-in
 * with the same name.
 *
 * <p>Events are queued for a single worker thread. The queue is bounded; when
 * it is full, or once the dispatcher has shut down, events are dropped and
 * counted in {@code stockgate.security.events.dropped}. {@link #dispatch}
 * never throws.
 */
@ApplicationScoped
public class SecurityEventDispatcher {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    static final int QUEUE_CAPACITY = 1024;
    private static final long DRAIN_TIMEOUT_SECONDS = 2;

    private final boolean enabled;
    private final List<SecurityEventHandler> candidates;
    private final Counter droppedEvents;
    private final int queueCapacity;

    private List<SecurityEventHandler> handlers = List.of();
    private ThreadPoolExecutor worker;
    private volatile boolean closed;

    @Inject
    public SecurityEventDispatcher(
            TelemetryConfigMapping config, Instance<SecurityEventHandler> beanHandlers, MeterRegistry meterRegistry) {
        this(
                config.enabled() && config.security().enabled(),
                merge(beanHandlers.stream().toList(), loadPlugins()),
                meterRegistry,
                QUEUE_CAPACITY);
    }

    SecurityEventDispatcher(
            boolean enabled, List<SecurityEventHandler> candidates, MeterRegistry meterRegistry, int queueCapacity) {
        this.enabled = enabled;
        this.candidates = List.copyOf(candidates);
        this.queueCapacity = queueCapacity;
        this.droppedEvents = Counter.builder("stockgate.security.events.dropped")
                .description("Security events dropped because the dispatch queue was full or closed")
                .register(meterRegistry);
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            LOG.debug("Security monitoring is disabled, no events will be dispatched");
            return;
        }

        handlers = candidates.stream()
                .filter(SecurityEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(SecurityEventHandler::priority).reversed())
                .toList();
        if (handlers.isEmpty()) {
            LOG.warn("Security monitoring is enabled but no handler is available");
            return;
        }

        worker = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(queueCapacity), runnable -> {
                    Thread thread = new Thread(runnable, "stockgate-security-events");
                    thread.setDaemon(true);
                    return thread;
                });
        LOG.infof(
                "Dispatching security events to %s (queue capacity %d)",
                handlers.stream().map(SecurityEventHandler::name).toList(),
                queueCapacity);
    }

    @PreDestroy
    void shutdown() {
        closed = true;
        if (worker != null) {
            worker.shutdown();
            try {
                if (!worker.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warnf("%d security event(s) not delivered at shutdown", worker.getQueue().size());
                    worker.shutdownNow();
                }
            } catch (InterruptedException e) {
                worker.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        for (SecurityEventHandler handler : handlers) {
            try {
                handler.close();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Security event handler %s failed to close", handler.name());
            }
        }
    }

    /**
     * Queue an event for every handler.
     *
     * @param event the event
     */
    public void dispatch(SecurityEvent event) {
        if (worker == null) {
            return;
        }
        if (closed) {
            droppedEvents.increment();
            return;
        }
        try {
            worker.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            droppedEvents.increment();
            LOG.debugf("Dropped %s: dispatch queue full or closed", event.getClass().getSimpleName());
        }
    }

    private void deliver(SecurityEvent event) {
        for (SecurityEventHandler handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Security event handler %s failed on %s", handler.name(), event.getClass().getSimpleName());
            }
        }
    }

    static List<SecurityEventHandler> loadPlugins() {
        List<SecurityEventHandler> plugins = new ArrayList<>();
        for (ServiceLoader.Provider<SecurityEventHandler> provider :
                ServiceLoader.load(SecurityEventHandler.class).stream().toList()) {
            plugins.add(provider.get());
        }
        return plugins;
    }

    static List<SecurityEventHandler> merge(List<SecurityEventHandler> beans, List<SecurityEventHandler> plugins) {
        List<SecurityEventHandler> merged = new ArrayList<>(beans);
        for (SecurityEventHandler plugin : plugins) {
            boolean shadowed = beans.stream().anyMatch(bean -> bean.name().equals(plugin.name()));
            if (shadowed) {
                LOG.debugf("Ignoring plug-in handler %s, a bean with that name exists", plugin.name());
            } else {
                merged.add(plugin);
            }
        }
        return merged;
    }
}
