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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A bounded pool of worker threads. At most {@code numThreads} units of work
 * run at the same time, the others wait in the queue of the pool.
 * <p>
 * The result of each unit of work is a {@link CompletableFuture} that is completed
 * exceptionally with the exception thrown by the work, so that the submitter can
 * join a group of units and get the first failure.
 * </p>
 */
@ThreadSafe
public class WorkerPool implements AutoCloseable
{
    /**
     * A unit of work without result.
     */
    @FunctionalInterface
    public interface Work
    {
        void run() throws Exception;
    }

    private final String name;
    private final int numThreads;
    private final ExecutorService executor;
    private final AtomicInteger threadCounter = new AtomicInteger(0);

    public WorkerPool(String name, int numThreads)
    {
        this.name = requireNonNull(name, "name is null");
        checkArgument(numThreads > 0, "numThreads must be positive");
        this.numThreads = numThreads;
        this.executor = Executors.newFixedThreadPool(numThreads, r -> {
            Thread t = Executors.defaultThreadFactory().newThread(r);
            t.setName(name + "-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public String getName()
    {
        return name;
    }

    public int getNumThreads()
    {
        return numThreads;
    }

    /**
     * @return the number of worker threads that have been started in this pool
     */
    public int getNumThreadsStarted()
    {
        return threadCounter.get();
    }

    public <T> CompletableFuture<T> submit(Callable<T> callable)
    {
        requireNonNull(callable, "callable is null");
        CompletableFuture<T> future = new CompletableFuture<>();
        try
        {
            executor.execute(() ->
            {
                try
                {
                    future.complete(callable.call());
                }
                catch (Throwable e)
                {
                    future.completeExceptionally(e);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            future.completeExceptionally(e);
        }
        return future;
    }

    public CompletableFuture<Void> execute(Work work)
    {
        requireNonNull(work, "work is null");
        return submit(() ->
        {
            work.run();
            return null;
        });
    }

    public boolean isShutdown()
    {
        return executor.isShutdown();
    }

    /**
     * Stop the pool. The queued units of work are dropped and the running ones
     * are interrupted, the latter happens only if the pool is closed after a failure.
     */
    @Override
    public void close()
    {
        executor.shutdownNow();
    }
}
