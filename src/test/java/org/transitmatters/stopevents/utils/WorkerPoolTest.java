package org.transitmatters.stopevents.utils;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class WorkerPoolTest {

    @Test
    public void resultsAreInInputOrder() throws Exception {
        List<Integer> inputs = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            inputs.add(i);
        }
        Set<String> threads = ConcurrentHashMap.newKeySet();

        List<Integer> results;
        try (WorkerPool pool = new WorkerPool(4)) {
            results = pool.map(inputs, i -> {
                threads.add(Thread.currentThread().getName());
                return i * 2;
            });
        }

        assertEquals(100, results.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(Integer.valueOf(i * 2), results.get(i));
        }
        assertTrue(threads.size() <= 4);
        assertTrue(threads.iterator().next().startsWith("stopevents-worker-"));
    }

    @Test
    public void failureIsRethrown() throws Exception {
        try (WorkerPool pool = new WorkerPool(2)) {
            pool.map(ImmutableList.of(1, 2, 3), i -> {
                if (i == 2) {
                    throw new IllegalStateException("boom");
                }
                return i;
            });
            fail("Expected an ExecutionException");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void cancelAbortsRunningWork() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        WorkerPool pool = new WorkerPool(1);
        Thread canceller = new Thread(() -> {
            try {
                started.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            pool.cancel();
        });
        canceller.start();

        try {
            pool.map(ImmutableList.of(1, 2, 3), i -> {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    throw new IllegalStateException("interrupted", e);
                }
                return i;
            });
            fail("Expected the work to be aborted");
        } catch (ExecutionException | CancellationException e) {
            // expected
        } finally {
            canceller.join();
            pool.close();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void workerCountMustBePositive() {
        new WorkerPool(0);
    }
}
