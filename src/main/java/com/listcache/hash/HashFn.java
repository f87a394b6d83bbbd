package com.listcache.hash;

/**
 * Anahtar baytlarını shard seçiminde kullanılan 32 bitlik imzaya dönüştüren
 * fonksiyonların sözleşmesidir. Sonuç işaretsiz kabul edilir ve shard sayısına
 * göre modu alınır; aynı süreç içinde aynı baytlar her zaman aynı değeri
 * üretmelidir.
 */
@FunctionalInterface
public interface HashFn {
    int hash(byte[] keyBytes);
}
