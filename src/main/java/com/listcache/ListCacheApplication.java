package com.listcache;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus uygulaması için giriş noktasıdır. Önbellek ve tahliye döngüsü CDI
 * konteyneri tarafından ayağa kaldırılır; ana thread çıkış sinyaline kadar
 * Quarkus runtime üzerinde bekler.
 */
@QuarkusMain
public class ListCacheApplication implements QuarkusApplication
{
    @Override
    public int run(String... args)
    {
        Quarkus.waitForExit();
        return 0;
    }

    public static void main(String... args) {
        Quarkus.run(ListCacheApplication.class, args);
    }
}
