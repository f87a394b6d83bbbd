package com.listcache.core;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Önbelleğin arka plan tahliye döngüsüdür. Tek bir daemon thread üzerinde sabit
 * aralıklarla tikler; her tikte imlecin gösterdiği shard'da bir tahliye geçişi
 * çalıştırır, ardından durdurma bayrağına bakar ve imleci bir sonraki shard'a
 * ilerletir. 64 shard olduğu için her shard yaklaşık
 * {@code tickInterval * 64} sürede bir ziyaret edilir.
 *
 * <p>Durdurulduğunda son bir süpürme yapılmaz; çalışmakta olan geçiş kendi
 * süre bütçesi içinde tamamlanır ve zamanlayıcı thread'i serbest bırakılır.
 */
final class EvictionLoop implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(EvictionLoop.class);

    private final ListCache<?> cache;
    private final long tickMillis;
    private final ScheduledExecutorService timer;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private volatile int cursor;

    EvictionLoop(ListCache<?> cache, Duration tickInterval)
    {
        this.cache = cache;
        this.tickMillis = Math.max(1L, tickInterval.toMillis());
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "list-cache-evictor");
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        timer.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        LOG.infof("Eviction loop started: one shard every %d ms", tickMillis);
    }

    void tick() {
        if (stopped.get()) {
            release();
            return;
        }
        int shard = cursor;
        try {
            cache.evictShard(shard);
        } catch (Throwable t) {
            LOG.errorf(t, "Eviction pass on shard %d failed", shard);
        }
        ticks.incrementAndGet();
        if (stopped.get()) {
            release();
            return;
        }
        cursor = (shard + 1) % ListCache.SHARD_COUNT;
    }

    int cursor() { return cursor; }

    long ticks() { return ticks.get(); }

    boolean isRunning() {
        return started.get() && !stopped.get();
    }

    private void release() {
        timer.shutdown();
    }

    @Override
    public void close() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        release();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Eviction loop did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.infof("Eviction loop stopped after %d ticks", ticks.get());
    }
}
