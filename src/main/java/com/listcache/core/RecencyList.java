package com.listcache.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bir shard içindeki girdileri en son kullanılandan en eski kullanılana doğru
 * sıralı tutan, indeks tabanlı çift yönlü listedir. Düğümler nesne yerine
 * paralel dizilerdeki slot numaralarıyla temsil edilir; silinen slotlar boş
 * slot zincirine eklenip yeni girdilerde tekrar kullanılır. Başa taşıma,
 * başa ekleme ve çıkarma işlemleri O(1) maliyetlidir.
 *
 * <p>Sınıf thread-safe değildir; erişim sahibi shard'ın kilidi altında yapılır.
 */
final class RecencyList<V>
{
    static final int NIL = -1;

    private String[] keys;
    private Object[] values;
    private int[] prev;
    private int[] next;

    private int head = NIL;
    private int tail = NIL;
    private int free = NIL;
    private int used;   // hiç kullanılmamış ilk slot
    private int size;

    RecencyList() {
        this(16);
    }

    RecencyList(int initialSlots) {
        int n = Math.max(1, initialSlots);
        keys = new String[n];
        values = new Object[n];
        prev = new int[n];
        next = new int[n];
    }

    int size() { return size; }
    int head() { return head; }
    int tail() { return tail; }
    int prev(int slot) { return prev[slot]; }
    String key(int slot) { return keys[slot]; }

    @SuppressWarnings("unchecked")
    V value(int slot) { return (V) values[slot]; }

    int pushFront(String key, V value) {
        int slot = allocate();
        keys[slot] = key;
        values[slot] = value;
        linkFront(slot);
        size++;
        return slot;
    }

    void moveToFront(int slot) {
        if (slot == head) return;
        unlink(slot);
        linkFront(slot);
    }

    void remove(int slot) {
        unlink(slot);
        keys[slot] = null;
        values[slot] = null;
        next[slot] = free;
        prev[slot] = NIL;
        free = slot;
        size--;
    }

    /** Anahtarları baştan (en yeni) sona (en eski) doğru döndürür. */
    List<String> keysInRecencyOrder() {
        List<String> out = new ArrayList<>(size);
        for (int s = head; s != NIL; s = next[s]) out.add(keys[s]);
        return out;
    }

    private int allocate() {
        if (free != NIL) {
            int slot = free;
            free = next[slot];
            return slot;
        }
        if (used == keys.length) grow();
        return used++;
    }

    private void grow() {
        int n = keys.length << 1;
        keys = Arrays.copyOf(keys, n);
        values = Arrays.copyOf(values, n);
        prev = Arrays.copyOf(prev, n);
        next = Arrays.copyOf(next, n);
    }

    private void linkFront(int slot) {
        prev[slot] = NIL;
        next[slot] = head;
        if (head != NIL) prev[head] = slot;
        head = slot;
        if (tail == NIL) tail = slot;
    }

    private void unlink(int slot) {
        int p = prev[slot], n = next[slot];
        if (p != NIL) next[p] = n; else head = n;
        if (n != NIL) prev[n] = p; else tail = p;
        prev[slot] = NIL;
        next[slot] = NIL;
    }
}
