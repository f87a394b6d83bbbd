package com.listcache.core;

/**
 * Önbellekte tutulan nesnelerin tahliye öncesi sorgulanan tek yeteneğidir.
 * Tahliye geçişi bir girdiyi listeden çıkarmadan önce nesneye silinmeye
 * uygun olup olmadığını sorar; nesne henüz diske yazılmamış değişiklik
 * taşıyorsa reddeder ve girdi önbellekte kalır.
 */
@FunctionalInterface
public interface Evictable
{
    /**
     * Nesneyi atomik olarak silinmek üzere işaretlemeyi dener.
     *
     * @return bekleyen değişiklik yoksa {@code true}; nesne artık silinmiş
     *         kabul edilir. Aksi halde {@code false} döner ve hiçbir yan etki
     *         bırakmaz, çağrı daha sonra tekrar denenebilir.
     */
    boolean trySetForDeletion();
}
