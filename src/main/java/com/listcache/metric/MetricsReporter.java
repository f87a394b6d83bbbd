package com.listcache.metric;

import com.listcache.config.AppProperties;
import io.quarkus.runtime.Startup;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Metrik kayıt defterindeki sayaç ve zamanlayıcıları belirli aralıklarla loga
 * yazan servistir. Vert.x periyodik zamanlayıcısıyla tetiklenir, raporu worker
 * havuzunda üretir ve kapatıldığında zamanlayıcıyı iptal eder.
 */
@Startup
@Singleton
public class MetricsReporter implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(MetricsReporter.class);

    private final MetricsRegistry registry;
    private final long intervalSeconds;
    private final Vertx vertx;
    private final WorkerExecutor workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private long timerId = -1L;

    @Inject
    public MetricsReporter(MetricsRegistry registry, AppProperties properties, Vertx vertx, WorkerExecutor workerExecutor) {
        this(registry, properties.metrics().reportIntervalSeconds(), vertx, workerExecutor);
    }

    public MetricsReporter(MetricsRegistry registry, long intervalSeconds, Vertx vertx, WorkerExecutor workerExecutor) {
        this.registry = registry;
        this.intervalSeconds = intervalSeconds;
        this.vertx = vertx;
        this.workerExecutor = workerExecutor;
    }

    @PostConstruct
    void init() {
        start(intervalSeconds);
    }

    public synchronized void start(long intervalSeconds) {
        if (intervalSeconds <= 0 || !running.compareAndSet(false, true)) {
            return;
        }
        long periodMillis = TimeUnit.SECONDS.toMillis(intervalSeconds);
        timerId = vertx.setPeriodic(periodMillis, id ->
                workerExecutor.executeBlocking(() -> {
                    LOG.info(render());
                    return null;
                })
        );
    }

    public boolean isRunning() {
        return running.get();
    }

    String render() {
        StringBuilder out = new StringBuilder("=== list-cache metrics ===");
        Map<String, Counter> counters = new TreeMap<>(registry.counters());
        counters.values().forEach(counter ->
                out.append(String.format("%ncounter %s = %d", counter.name(), counter.get()))
        );
        Map<String, Timer> timers = new TreeMap<>(registry.timers());
        timers.values().forEach(timer -> {
            var sample = timer.snapshot();
            out.append(String.format(
                    "%ntimer %s count=%d avg=%.2fµs p50=%.2fµs p95=%.2fµs p99=%.2fµs max=%.2fµs",
                    sample.name(),
                    sample.count(),
                    sample.avgNs() / 1_000.0,
                    sample.p50Ns() / 1_000.0,
                    sample.p95Ns() / 1_000.0,
                    sample.p99Ns() / 1_000.0,
                    sample.maxNs() / 1_000.0
            ));
        });
        return out.toString();
    }

    @PreDestroy
    void shutdown() {
        close();
    }

    @Override
    public synchronized void close() {
        running.set(false);
        if (timerId >= 0L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }
    }
}
