package com.listcache.metric;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code lru_*} sayaçlarını ve gecikme zamanlayıcılarını isimle eşleyen kayıt.
 * {@link com.listcache.core.ListCache} kendi metriklerini kurulurken buradan
 * alır; {@link MetricsReporter} dökümü salt okunur görünümler üzerinden yapar.
 */
public final class MetricsRegistry {
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public Counter counter(String name) { return counters.computeIfAbsent(name, Counter::new); }
    public Timer timer(String name) { return timers.computeIfAbsent(name, Timer::new); }

    public Map<String, Counter> counters() { return Collections.unmodifiableMap(counters); }
    public Map<String, Timer> timers() { return Collections.unmodifiableMap(timers); }
}
