package com.listcache.metric;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Operasyon sürelerini ve tahliye geçişlerinin kilit tutma sürelerini toplayan
 * zamanlayıcıdır. Son {@code reservoirSize} ölçümü dairesel bir tamponda
 * saklayarak p50/p95/p99 değerlerini kestirir.
 */
public final class Timer
{
    private final String name;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalNs = new LongAdder();
    private final LongAccumulator minNs = new LongAccumulator(Math::min, Long.MAX_VALUE);
    private final LongAccumulator maxNs = new LongAccumulator(Math::max, Long.MIN_VALUE);

    private final long[] reservoir;
    private final AtomicInteger cursor = new AtomicInteger();

    public Timer(String name) { this(name, 1024); }
    public Timer(String name, int reservoirSize) {
        this.name = name;
        this.reservoir = new long[Math.max(128, reservoirSize)];
    }

    public void record(long durationNs)
    {
        count.increment();
        totalNs.add(durationNs);
        minNs.accumulate(durationNs);
        maxNs.accumulate(durationNs);
        int i = Math.floorMod(cursor.getAndIncrement(), reservoir.length);
        reservoir[i] = durationNs;
    }

    /** {@code System.nanoTime()} ile alınmış başlangıçtan bu yana geçen süreyi kaydeder. */
    public void recordSince(long startNanos) {
        record(System.nanoTime() - startNanos);
    }

    public Sample snapshot() {
        long c = count.sum();
        long t = totalNs.sum();
        double avg = c == 0 ? 0.0 : (double) t / c;
        long min = c == 0 ? 0 : minNs.get();
        long max = c == 0 ? 0 : maxNs.get();

        int filled = (int) Math.min(c, reservoir.length);
        long[] copy = Arrays.copyOf(reservoir, filled);
        Arrays.sort(copy);
        return new Sample(name, c, t, avg, min, max,
                percentile(copy, 0.50), percentile(copy, 0.95), percentile(copy, 0.99));
    }

    private static long percentile(long[] sorted, double q) {
        if (sorted.length == 0) return 0;
        return sorted[(int) (q * (sorted.length - 1))];
    }

    /**
     * Zamanlayıcının anlık durumunu taşıyan değişmez kayıttır.
     */
    public record Sample(String name, long count, long totalNs, double avgNs,
                         long minNs, long maxNs, long p50Ns, long p95Ns, long p99Ns) {}
}
