package com.listcache.metric;

import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsComponentsTest
{
    @Nested
    class CounterBehavior
    {
        // Bu test sayaç artışının ve toplamanın değeri doğru güncellediğini doğrular.
        @Test
        void counter_handles_increment_and_add()
        {
            Counter counter = new Counter("lru_evictions");
            counter.inc();
            counter.add(4);
            counter.add(0);
            assertEquals(5, counter.get());
            assertEquals("lru_evictions", counter.name());
        }
    }

    @Nested
    class TimerBehavior
    {
        // Bu test süre kayıtlarının istatistiklere yansıtıldığını gösterir.
        @Test
        void timer_aggregates_durations_into_statistics()
        {
            Timer timer = new Timer("lru_evict_lock_hold", 128);
            timer.record(1_000);
            timer.record(2_000);
            timer.record(3_000);
            Timer.Sample sample = timer.snapshot();
            assertEquals("lru_evict_lock_hold", sample.name());
            assertEquals(3, sample.count());
            assertEquals(6_000, sample.totalNs());
            assertEquals(1_000, sample.minNs());
            assertEquals(3_000, sample.maxNs());
            assertEquals(2_000.0, sample.avgNs());
            assertEquals(2_000, sample.p50Ns());
        }

        // Bu test boş zamanlayıcının sıfır değerli bir özet döndürdüğünü doğrular.
        @Test
        void empty_timer_reports_zeroes()
        {
            Timer.Sample sample = new Timer("idle").snapshot();
            assertEquals(0, sample.count());
            assertEquals(0, sample.minNs());
            assertEquals(0, sample.maxNs());
            assertEquals(0, sample.p99Ns());
        }

        // Bu test tampon dolduğunda eski ölçümlerin üzerine yazıldığını gösterir.
        @Test
        void reservoir_wraps_around()
        {
            Timer timer = new Timer("wrap", 128);
            for (int i = 0; i < 128; i++) timer.record(1);
            for (int i = 0; i < 128; i++) timer.record(9);
            Timer.Sample sample = timer.snapshot();
            assertEquals(256, sample.count());
            assertEquals(9, sample.p50Ns());
            assertEquals(1, sample.minNs());
        }
    }

    @Nested
    class RegistryBehavior
    {
        // Bu test aynı isim için aynı sayaç ve zamanlayıcının döndüğünü doğrular.
        @Test
        void registry_reuses_components_with_same_name()
        {
            MetricsRegistry registry = new MetricsRegistry();
            Counter firstCounter = registry.counter("lru_hits");
            Counter secondCounter = registry.counter("lru_hits");
            Timer firstTimer = registry.timer("lru_get");
            Timer secondTimer = registry.timer("lru_get");
            assertSame(firstCounter, secondCounter);
            assertSame(firstTimer, secondTimer);
            assertTrue(registry.counters().containsKey("lru_hits"));
            assertTrue(registry.timers().containsKey("lru_get"));
            assertThrows(UnsupportedOperationException.class, () -> registry.counters().clear());
        }
    }

    @Nested
    class ReporterBehavior
    {
        // Bu test geçerli aralıkla başlatılan raporlama görevlerinin çalıştığını doğrular.
        @Test
        void reporter_runs_with_valid_interval()
        {
            MetricsRegistry registry = new MetricsRegistry();
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                MetricsReporter reporter = new MetricsReporter(registry, 1, vertx, worker);
                reporter.start(1);
                assertTrue(reporter.isRunning());
                reporter.close();
                assertFalse(reporter.isRunning());
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }

        // Bu test geçersiz aralıkta raporlayıcının başlamadığını gösterir.
        @Test
        void reporter_ignores_invalid_interval()
        {
            MetricsRegistry registry = new MetricsRegistry();
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                MetricsReporter reporter = new MetricsReporter(registry, 0, vertx, worker);
                reporter.start(0);
                assertFalse(reporter.isRunning());
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }

        // Bu test raporun tüm sayaç ve zamanlayıcıları isim sırasıyla içerdiğini doğrular.
        @Test
        void render_lists_counters_and_timers()
        {
            MetricsRegistry registry = new MetricsRegistry();
            registry.counter("lru_misses").add(2);
            registry.counter("lru_hits").add(7);
            registry.timer("lru_get").record(5_000);
            Vertx vertx = Vertx.vertx();
            WorkerExecutor worker = vertx.createSharedWorkerExecutor("metrics-test");
            try
            {
                String report = new MetricsReporter(registry, 0, vertx, worker).render();
                assertTrue(report.contains("counter lru_hits = 7"));
                assertTrue(report.contains("counter lru_misses = 2"));
                assertTrue(report.contains("timer lru_get count=1"));
                assertTrue(report.indexOf("lru_hits") < report.indexOf("lru_misses"));
            }
            finally
            {
                worker.close();
                vertx.close().toCompletionStage().toCompletableFuture().join();
            }
        }
    }
}
