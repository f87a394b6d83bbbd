package com.listcache.core;

import com.listcache.core.model.EvictionReport;
import com.listcache.hash.HashFn;
import com.listcache.hash.Murmur3HashFn;
import com.listcache.metric.Counter;
import com.listcache.metric.MetricsRegistry;
import com.listcache.metric.Timer;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Değiştirilebilir liste nesnelerini (posting list) pahalı depolama katmanının
 * önünde tutan, sabit 64 shard'a bölünmüş LRU önbellektir. Her anahtar
 * {@code hash(key) mod 64} ile her zaman aynı shard'a yönlendirilir ve tüm
 * işlemler yalnızca o shard'ın kilidini alır; farklı shard'lardaki anahtarlar
 * birbirini beklemez.
 *
 * <p>Kapasite eklemeler sırasında zorlanmaz. Arka plandaki {@link EvictionLoop}
 * her tikte tek bir shard'ı ziyaret eder ve süre bütçesiyle sınırlı bir tahliye
 * geçişi çalıştırır. Tahliye, nesne {@link Evictable#trySetForDeletion()}
 * çağrısını kabul etmeden hiçbir girdiyi silmez.
 */
public final class ListCache<V extends Evictable> implements AutoCloseable
{
    private static final Logger LOG = Logger.getLogger(ListCache.class);

    public static final int SHARD_COUNT = 64;

    public static final String METRIC_HITS = "lru_hits";
    public static final String METRIC_MISSES = "lru_misses";
    public static final String METRIC_INSERTS = "lru_inserts";
    public static final String METRIC_EVICTIONS = "lru_evictions";
    public static final String METRIC_EVICTION_SKIPS = "lru_eviction_skips";
    public static final String TIMER_GET = "lru_get";
    public static final String TIMER_PUT = "lru_put";
    public static final String TIMER_DEL = "lru_del";
    public static final String TIMER_LOCK_HOLD = "lru_evict_lock_hold";

    private final ListCacheShard<V>[] shards;
    private final int shardCapacity;
    private final HashFn hashFn;
    private final long evictionBudgetNanos;
    private final LongSupplier nanoClock;
    private final EvictionLoop loop;

    private final Counter hits, misses, inserts, evictions, skips;
    private final Timer tGet, tPut, tDel, tLockHold;

    @SuppressWarnings("unchecked")
    private ListCache(int shardCapacity, Duration tickInterval, Duration evictionBudget,
                      HashFn hashFn, LongSupplier nanoClock, MetricsRegistry metrics) {
        this.shardCapacity = shardCapacity;
        this.shards = new ListCacheShard[SHARD_COUNT];
        for (int i = 0; i < SHARD_COUNT; i++) shards[i] = new ListCacheShard<>(i, shardCapacity);

        this.hashFn = hashFn;
        this.evictionBudgetNanos = evictionBudget.toNanos();
        this.nanoClock = nanoClock;

        if (metrics != null) {
            this.hits = metrics.counter(METRIC_HITS);
            this.misses = metrics.counter(METRIC_MISSES);
            this.inserts = metrics.counter(METRIC_INSERTS);
            this.evictions = metrics.counter(METRIC_EVICTIONS);
            this.skips = metrics.counter(METRIC_EVICTION_SKIPS);
            this.tGet = metrics.timer(TIMER_GET);
            this.tPut = metrics.timer(TIMER_PUT);
            this.tDel = metrics.timer(TIMER_DEL);
            this.tLockHold = metrics.timer(TIMER_LOCK_HOLD);
        } else {
            this.hits = this.misses = this.inserts = this.evictions = this.skips = null;
            this.tGet = this.tPut = this.tDel = this.tLockHold = null;
        }

        this.loop = new EvictionLoop(this, tickInterval);
        loop.start();
    }

    public static <V extends Evictable> Builder<V> builder() { return new Builder<>(); }

    /**
     * Shard kapasitesi, tik aralığı ve tahliye bütçesi gibi parametreleri
     * ayarlayan akıcı yapılandırma sınıfıdır. Tahliye döngüsü {@link #build()}
     * çağrısında başlar.
     */
    public static final class Builder<V extends Evictable>
    {
        private int shardCapacity = 1_000;
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration evictionBudget = Duration.ofMillis(10);
        private HashFn hashFn = Murmur3HashFn.INSTANCE;
        private LongSupplier nanoClock = System::nanoTime;
        private MetricsRegistry metrics;

        private Builder() {}

        /** Her shard için hedef girdi sayısı; 0 sınırsız demektir ve tahliyeyi kapatır. */
        public Builder<V> shardCapacity(int c) {
            if (c < 0) throw new IllegalArgumentException("shardCapacity must be >= 0: " + c);
            this.shardCapacity = c; return this;
        }
        public Builder<V> tickInterval(Duration d) { this.tickInterval = positive(d, "tickInterval"); return this; }
        public Builder<V> evictionBudget(Duration d) { this.evictionBudget = positive(d, "evictionBudget"); return this; }
        public Builder<V> hashFn(HashFn h) { this.hashFn = Objects.requireNonNull(h); return this; }
        public Builder<V> nanoClock(LongSupplier c) { this.nanoClock = Objects.requireNonNull(c); return this; }
        public Builder<V> metrics(MetricsRegistry m) { this.metrics = m; return this; }

        public ListCache<V> build() {
            return new ListCache<>(shardCapacity, tickInterval, evictionBudget, hashFn, nanoClock, metrics);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive: " + d);
            return d;
        }
    }

    public int shardIndex(String key) {
        Objects.requireNonNull(key);
        return Integer.remainderUnsigned(hashFn.hash(key.getBytes(StandardCharsets.UTF_8)), SHARD_COUNT);
    }

    private ListCacheShard<V> shard(String key) { return shards[shardIndex(key)]; }

    /**
     * Anahtar önbellekteyse saklı değeri döndürür ve aday değeri yok sayar;
     * değilse adayı en yeni konuma ekler ve onu döndürür. Her iki durumda da
     * anahtar listenin başına taşınır. Yarışı kaybeden çağıran, elindeki adayı
     * bırakıp dönen değeri kullanmalıdır.
     */
    public V putIfMissing(String key, V candidate) {
        long t0 = System.nanoTime();
        Objects.requireNonNull(candidate);
        ListCacheShard.Admission<V> admission = shard(key).admit(key, candidate);
        if (admission.inserted() && inserts != null) inserts.inc();
        if (tPut != null) tPut.recordSince(t0);
        return admission.value();
    }

    public V get(String key) {
        long t0 = System.nanoTime();
        V out = shard(key).get(key);
        if (out != null) {
            if (hits != null) hits.inc();
        } else if (misses != null) misses.inc();
        if (tGet != null) tGet.recordSince(t0);
        return out;
    }

    /**
     * Girdiyi koşulsuz olarak kaldırır. Nesnenin silinme iznine bakılmaz; bu
     * yönetimsel bir silmedir ve nesnenin kendi yaşam döngüsüyle eşgüdüm
     * çağıranın sorumluluğundadır.
     *
     * @return anahtar önbellekte idiyse {@code true}
     */
    public boolean delete(String key) {
        long t0 = System.nanoTime();
        boolean removed = shard(key).remove(key) != null;
        if (tDel != null) tDel.recordSince(t0);
        return removed;
    }

    /**
     * Verilen shard üzerinde tek bir tahliye geçişini eşzamanlı olarak çalıştırır.
     * Geçiş shard kilidini en fazla tahliye bütçesi kadar tutar.
     */
    public EvictionReport evictShard(int shard) {
        Objects.checkIndex(shard, SHARD_COUNT);
        EvictionReport report = shards[shard].evict(evictionBudgetNanos, nanoClock);
        record(report);
        return report;
    }

    private void record(EvictionReport report) {
        if (evictions != null) evictions.add(report.evicted());
        if (skips != null) skips.add(report.skipped());
        if (tLockHold != null) tLockHold.record(report.lockHeldNanos());
        LOG.debugf("lru eviction for shard %d blocked for %d µs (size %d -> %d, evicted %d, skipped %d)",
                report.shard(), report.lockHeldNanos() / 1_000, report.sizeBefore(), report.sizeAfter(),
                report.evicted(), report.skipped());
        if (report.overCapacity() && report.skipped() > 0) {
            LOG.debugf("Shard %d stays above capacity %d: %d entries have pending mutations",
                    report.shard(), report.capacity(), report.skipped());
        }
    }

    public int shardSize(int shard) {
        Objects.checkIndex(shard, SHARD_COUNT);
        return shards[shard].size();
    }

    /** Shard'lar tek tek kilitlenerek toplanır; sonuç anlık bir tahmindir. */
    public int size() {
        int t = 0;
        for (ListCacheShard<V> s : shards) t += s.size();
        return t;
    }

    public int shardCapacity() { return shardCapacity; }

    public boolean isEvictionRunning() { return loop.isRunning(); }

    List<String> keysInRecencyOrder(int shard) {
        return shards[shard].keysInRecencyOrder();
    }

    EvictionLoop loop() { return loop; }

    @Override
    public void close() {
        loop.close();
    }
}
