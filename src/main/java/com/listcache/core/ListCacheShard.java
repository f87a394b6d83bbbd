package com.listcache.core;

import com.listcache.core.model.EvictionReport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Önbelleğin kilitleme ve tahliye birimi olan shard yapısıdır. Her shard
 * kendi {@link RecencyList} listesini, anahtardan slot numarasına giden
 * indeksini ve bunları birlikte koruyan tek bir {@link ReentrantLock} kilidini
 * taşır. Kapasite kesin bir üst sınır değil, arka plandaki tahliye geçişinin
 * hedeflediği değerdir; eklemeler arasında liste kapasiteyi geçici olarak
 * aşabilir.
 */
final class ListCacheShard<V extends Evictable>
{
    private final ReentrantLock lock = new ReentrantLock();
    private final int id;
    private final int capacity;
    private final RecencyList<V> list = new RecencyList<>();
    private final Map<String, Integer> index = new HashMap<>();

    ListCacheShard(int id, int capacity)
    {
        if (capacity < 0) throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
        this.id = id;
        this.capacity = capacity;
    }

    V get(String key) {
        lock.lock();
        try {
            Integer slot = index.get(key);
            if (slot == null) return null;
            list.moveToFront(slot);
            return list.value(slot);
        }
        finally { lock.unlock(); }
    }

    V putIfMissing(String key, V candidate) {
        return admit(key, candidate).value();
    }

    /**
     * Yoksa ekle işleminin kendisidir; dönen kayıt, adayın gerçekten eklenip
     * eklenmediğini de taşır. Saklı örnekle aynı nesne tekrar verilirse bu bir
     * ekleme sayılmaz.
     */
    Admission<V> admit(String key, V candidate) {
        lock.lock();
        try {
            Integer slot = index.get(key);
            if (slot != null) {
                list.moveToFront(slot);
                return new Admission<>(list.value(slot), false);
            }
            index.put(key, list.pushFront(key, candidate));
            return new Admission<>(candidate, true);
        }
        finally { lock.unlock(); }
    }

    record Admission<V>(V value, boolean inserted) {}

    V remove(String key) {
        lock.lock();
        try {
            Integer slot = index.remove(key);
            if (slot == null) return null;
            V removed = list.value(slot);
            list.remove(slot);
            return removed;
        }
        finally { lock.unlock(); }
    }

    /**
     * Kapasite aşılmışsa listenin soğuk ucundan başlayarak girdileri tahliye
     * eder. Silinmeyi reddeden nesneler yerinde bırakılır ve tarama bir önceki
     * (daha yeni) girdiye kayar; liste sırası değişmez. Geçiş kilidi en fazla
     * {@code budgetNanos} kadar tutar.
     */
    EvictionReport evict(long budgetNanos, LongSupplier nanoClock) {
        lock.lock();
        long start = nanoClock.getAsLong();
        try {
            int before = list.size();
            if (capacity == 0) {
                return EvictionReport.unlimited(id, before, nanoClock.getAsLong() - start);
            }

            long deadline = start + budgetNanos;
            int evicted = 0, skipped = 0;
            boolean deadlineReached = false;
            int slot = list.tail();
            while (list.size() > capacity) {
                if (nanoClock.getAsLong() - deadline >= 0) {
                    deadlineReached = true;
                    break;
                }
                if (slot == RecencyList.NIL) break;

                int predecessor = list.prev(slot);
                if (!list.value(slot).trySetForDeletion()) {
                    skipped++;
                    slot = predecessor;
                    continue;
                }
                index.remove(list.key(slot));
                list.remove(slot);
                evicted++;
                slot = predecessor;
            }
            return new EvictionReport(id, capacity, before, list.size(), evicted, skipped,
                    nanoClock.getAsLong() - start, deadlineReached);
        }
        finally { lock.unlock(); }
    }

    int size() {
        lock.lock(); try { return list.size(); } finally { lock.unlock(); }
    }

    boolean contains(String key) {
        lock.lock(); try { return index.containsKey(key); } finally { lock.unlock(); }
    }

    List<String> keysInRecencyOrder() {
        lock.lock(); try { return list.keysInRecencyOrder(); } finally { lock.unlock(); }
    }
}
