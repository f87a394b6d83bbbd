package com.listcache.core.model;

/**
 * Tek bir shard üzerinde yapılan tahliye geçişinin sonucunu taşır. Kilit
 * tutma süresi çekişme sorunlarını fark etmek için loglanır; değerler kontrol
 * akışını etkilemez.
 *
 * @param capacity        shard kapasitesi, 0 sınırsız demektir
 * @param skipped         silinmeyi reddettiği için atlanan girdi sayısı
 * @param deadlineReached geçiş süre bütçesi dolduğu için durduysa {@code true}
 */
public record EvictionReport(int shard,
                             int capacity,
                             int sizeBefore,
                             int sizeAfter,
                             int evicted,
                             int skipped,
                             long lockHeldNanos,
                             boolean deadlineReached)
{
    public static EvictionReport unlimited(int shard, int size, long lockHeldNanos) {
        return new EvictionReport(shard, 0, size, size, 0, 0, lockHeldNanos, false);
    }

    public boolean overCapacity() {
        return capacity > 0 && sizeAfter > capacity;
    }
}
