/*
 * Copyright 2024 TsvStore.
 *
 * This file is part of TsvStore.
 *
 * TsvStore is free software: you can redistribute it and/or modify
 * it under the terms of the Affero GNU General Public License as
 * published by the Free Software Foundation, either version 3 of
 * the License, or (at your option) any later version.
 *
 * TsvStore is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * Affero GNU General Public License for more details.
 *
 * You should have received a copy of the Affero GNU General Public
 * License along with TsvStore.  If not, see
 * <https://www.gnu.org/licenses/>.
 */
package io.tsvstore.core.utils;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestWorkerPool
{
    @Test
    public void testBoundedConcurrency() throws Exception
    {
        AtomicInteger running = new AtomicInteger(0);
        AtomicInteger maxRunning = new AtomicInteger(0);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try (WorkerPool pool = new WorkerPool("test", 3))
        {
            for (int i = 0; i < 20; ++i)
            {
                futures.add(pool.execute(() -> {
                    int now = running.incrementAndGet();
                    maxRunning.accumulateAndGet(now, Math::max);
                    Thread.sleep(10);
                    running.decrementAndGet();
                }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            assertTrue(maxRunning.get() <= 3);
            assertTrue(pool.getNumThreadsStarted() <= 3);
        }
    }

    @Test
    public void testSubmitResultAndThreadName() throws Exception
    {
        try (WorkerPool pool = new WorkerPool("named", 2))
        {
            String threadName = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
            assertTrue(threadName.startsWith("named-"));
            assertEquals(42, (int) pool.submit(() -> 42).join());
        }
    }

    @Test
    public void testFailureCompletesFutureExceptionally()
    {
        try (WorkerPool pool = new WorkerPool("failing", 2))
        {
            CompletableFuture<Void> future = pool.execute(() -> {
                throw new IllegalStateException("boom");
            });
            try
            {
                future.join();
                fail("the future should complete exceptionally");
            }
            catch (CompletionException e)
            {
                assertTrue(e.getCause() instanceof IllegalStateException);
                assertEquals("boom", e.getCause().getMessage());
            }
        }
    }

    @Test
    public void testCloseInterruptsRunningWork() throws Exception
    {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        WorkerPool pool = new WorkerPool("closing", 1);
        pool.execute(() -> {
            started.countDown();
            try
            {
                Thread.sleep(60_000);
            }
            catch (InterruptedException e)
            {
                interrupted.countDown();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));
        pool.close();
        assertTrue(pool.isShutdown());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        // work submitted after close is rejected
        assertTrue(pool.execute(() -> {}).isCompletedExceptionally());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroThreads()
    {
        new WorkerPool("empty", 0);
    }
}
