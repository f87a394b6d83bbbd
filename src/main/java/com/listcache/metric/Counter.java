package com.listcache.metric;

import java.util.concurrent.atomic.LongAdder;

/**
 * Tek bir önbellek olayının toplam sayısı. Tahliye geçişi {@link #add(long)}
 * ile toplu artırır; sıfır artış yok sayılır.
 */
public final class Counter
{
    private final String name;
    private final LongAdder value = new LongAdder();

    public Counter(String name) { this.name = name; }

    public void inc() { value.increment(); }
    public void add(long delta) { if (delta != 0) value.add(delta); }
    public long get() { return value.sum(); }
    public String name() { return name; }
}
