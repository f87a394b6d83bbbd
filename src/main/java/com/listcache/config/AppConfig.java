package com.listcache.config;

import com.listcache.core.ListCache;
import com.listcache.hash.HashFn;
import com.listcache.hash.Murmur3HashFn;
import com.listcache.metric.MetricsRegistry;
import com.listcache.posting.PostingList;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı önbellek, metrik kayıt
 * defteri, hash fonksiyonu ve arka plan işleri için worker havuzu gibi tekil
 * bean'leri üretir. Değerler {@link AppProperties} üzerinden okunur; önbellek
 * kapatılırken tahliye döngüsü de durdurulur.
 */
@ApplicationScoped
public class AppConfig {

    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties) {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public MetricsRegistry metricsRegistry() {
        return new MetricsRegistry();
    }

    @Produces
    @Singleton
    public HashFn hashFn() {
        return Murmur3HashFn.INSTANCE;
    }

    @Produces
    @Singleton
    public WorkerExecutor workerExecutor(Vertx vertx) {
        return vertx.createSharedWorkerExecutor("list-cache-worker", 1);
    }

    void disposeWorkerExecutor(@Disposes WorkerExecutor workerExecutor) {
        workerExecutor.close();
    }

    @Produces
    @Singleton
    public ListCache<PostingList> listCache(MetricsRegistry metrics, HashFn hashFn) {
        var cacheProps = properties.cache();
        ListCache<PostingList> cache = ListCache.<PostingList>builder()
                .shardCapacity(cacheProps.shardCapacity())
                .tickInterval(Duration.ofMillis(cacheProps.tickIntervalMillis()))
                .evictionBudget(Duration.ofMillis(cacheProps.evictionBudgetMillis()))
                .hashFn(hashFn)
                .metrics(metrics)
                .build();
        LOG.infof("List cache ready: %d shards, capacity %d per shard",
                ListCache.SHARD_COUNT, cacheProps.shardCapacity());
        return cache;
    }

    void disposeListCache(@Disposes ListCache<PostingList> cache) {
        cache.close();
    }
}
