package com.fixcraft.veilforge;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Data-parallel loop over independent units (video frames). A {@code null} pool runs inline.
 */
final class Parallel {
    private Parallel() {}

    interface IndexedRunnable {
        void run(int index);
    }

    static void forEachIndex(int count, IndexedRunnable task) {
        ExecutorService pool = newPool(count);
        try {
            forEachIndex(pool, count, task);
        } finally {
            shutdownPool(pool);
        }
    }

    /** Pool sized for batches of {@code batchSize} units, or {@code null} when one worker suffices. */
    static ExecutorService newPool(int batchSize) {
        int workers = Math.min(StegoConfig.mediaWorkers(), batchSize);
        return workers > 1 ? Executors.newFixedThreadPool(workers) : null;
    }

    static void forEachIndex(ExecutorService pool, int count, IndexedRunnable task) {
        if (count <= 0) {
            return;
        }
        if (pool == null || count == 1) {
            for (int i = 0; i < count; i++) {
                task.run(i);
            }
            return;
        }
        CountDownLatch latch = new CountDownLatch(count);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        for (int i = 0; i < count; i++) {
            final int idx = i;
            pool.execute(() -> {
                try {
                    task.run(idx);
                } catch (RuntimeException exc) {
                    failure.compareAndSet(null, exc);
                } finally {
                    latch.countDown();
                }
            });
        }
        try {
            latch.await();
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Parallel operation interrupted", exc);
        }
        if (failure.get() != null) {
            throw failure.get();
        }
    }

    static void shutdownPool(ExecutorService pool) {
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
