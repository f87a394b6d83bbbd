package com.listcache.posting;

import com.listcache.core.Evictable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bir anahtara ait uid kümesini ve henüz kalıcı hale getirilmemiş
 * değişiklikleri tutan posting list nesnesidir. Bekleyen değişiklik varken
 * silinmek üzere işaretlenmeyi reddeder; işaretlendikten sonra yeni değişiklik
 * kabul etmez ve çağıranın önbellekten taze bir liste alması gerekir.
 */
public final class PostingList implements Evictable
{
    public enum Op { ADD, DEL }

    private final String key;
    private final ReentrantLock lock = new ReentrantLock();
    private final TreeSet<Long> committed = new TreeSet<>();
    private final Map<Long, Op> pending = new LinkedHashMap<>();
    private boolean deleteMe;

    public PostingList(String key, Collection<Long> uids)
    {
        this.key = Objects.requireNonNull(key);
        committed.addAll(uids);
    }

    public String key() { return key; }

    /**
     * Uid için bekleyen bir değişiklik kaydeder; aynı uid için önceki bekleyen
     * değişikliğin üzerine yazar.
     *
     * @return liste silinmek üzere işaretlendiyse {@code false}
     */
    public boolean addMutation(long uid, Op op) {
        Objects.requireNonNull(op);
        lock.lock();
        try {
            if (deleteMe) return false;
            pending.put(uid, op);
            return true;
        }
        finally { lock.unlock(); }
    }

    /** Bekleyen değişiklikleri kalıcı kümeye uygular ve uygulanan sayısını döndürür. */
    public int commit() {
        lock.lock();
        try {
            int applied = pending.size();
            pending.forEach(this::apply);
            pending.clear();
            return applied;
        }
        finally { lock.unlock(); }
    }

    @Override
    public boolean trySetForDeletion() {
        lock.lock();
        try {
            if (!pending.isEmpty()) return false;
            deleteMe = true;
            return true;
        }
        finally { lock.unlock(); }
    }

    public boolean isMarkedForDeletion() {
        lock.lock(); try { return deleteMe; } finally { lock.unlock(); }
    }

    public int pendingMutations() {
        lock.lock(); try { return pending.size(); } finally { lock.unlock(); }
    }

    /** Bekleyen değişiklikler uygulanmış haliyle uid'leri artan sırada döndürür. */
    public List<Long> uids() {
        lock.lock();
        try {
            TreeSet<Long> view = new TreeSet<>(committed);
            pending.forEach((uid, op) -> {
                if (op == Op.ADD) view.add(uid); else view.remove(uid);
            });
            return new ArrayList<>(view);
        }
        finally { lock.unlock(); }
    }

    private void apply(Long uid, Op op) {
        if (op == Op.ADD) committed.add(uid); else committed.remove(uid);
    }

    @Override
    public String toString() {
        return "PostingList{key='" + key + "', pending=" + pendingMutations() + '}';
    }
}
