package com.listcache.hash;

/**
 * MurmurHash3 x86 32 bit varyantı. Anahtar dağılımı tekdüze olduğundan
 * {@code hash mod 64} ile shard seçimi için varsayılan fonksiyondur.
 */
public final class Murmur3HashFn implements HashFn
{
    public static final Murmur3HashFn INSTANCE = new Murmur3HashFn(0);

    private static final int C1 = 0xcc9e2d51;
    private static final int C2 = 0x1b873593;

    private final int seed;

    public Murmur3HashFn(int seed) {
        this.seed = seed;
    }

    @Override
    public int hash(byte[] keyBytes)
    {
        int len = keyBytes.length;
        int h = seed;
        int blocks = len >>> 2;

        for (int i = 0; i < blocks; i++) {
            int off = i << 2;
            int k = (keyBytes[off] & 0xff)
                    | (keyBytes[off + 1] & 0xff) << 8
                    | (keyBytes[off + 2] & 0xff) << 16
                    | (keyBytes[off + 3] & 0xff) << 24;
            h ^= mixK(k);
            h = Integer.rotateLeft(h, 13);
            h = h * 5 + 0xe6546b64;
        }

        int tail = blocks << 2;
        int k = 0;
        switch (len & 3) {
            case 3:
                k ^= (keyBytes[tail + 2] & 0xff) << 16;
            case 2:
                k ^= (keyBytes[tail + 1] & 0xff) << 8;
            case 1:
                k ^= keyBytes[tail] & 0xff;
                h ^= mixK(k);
            default:
                break;
        }

        h ^= len;
        return fmix(h);
    }

    private static int mixK(int k) {
        k *= C1;
        k = Integer.rotateLeft(k, 15);
        return k * C2;
    }

    private static int fmix(int h) {
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }
}
