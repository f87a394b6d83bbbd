package com.listcache.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Uygulama yapılandırma değerlerini tip güvenli olarak okuyan konfigürasyon
 * arayüzüdür. {@code application.properties} içindeki "app" önekli değerleri
 * önbellek shard kapasitesi, tahliye döngüsünün tik aralığı ve süre bütçesi
 * ile metrik raporlama sıklığı olarak gruplar.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Cache cache();
    Metrics metrics();

    interface Cache {
        /** 0 sınırsız kapasite demektir; tahliye hiç çalışmaz. */
        @WithDefault("1000")
        int shardCapacity();

        @WithDefault("1000")
        long tickIntervalMillis();

        @WithDefault("10")
        long evictionBudgetMillis();
    }

    interface Metrics {
        @WithDefault("30")
        long reportIntervalSeconds();
    }
}
