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
package io.tsvstore.core.column;

import io.tsvstore.core.vector.ColumnVector;
import io.tsvstore.core.vector.FloatColumnVector;
import io.tsvstore.core.vector.StringColumnVector;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A column for tests that records how it is written. Each add sleeps for a while
 * so that overlapping writers, if any, are observed.
 */
public class RecordingColumn extends Column
{
    private final ColumnType type;
    private final AtomicInteger activeWriters = new AtomicInteger(0);
    private final AtomicInteger maxActiveWriters = new AtomicInteger(0);
    private final AtomicInteger numAdds = new AtomicInteger(0);
    private final AtomicInteger numFinalizes = new AtomicInteger(0);
    private volatile int numAddsAtFinalize = -1;
    private final List<Object> values = new ArrayList<>();

    public RecordingColumn(ColumnType type, String name)
    {
        super(name);
        this.type = type;
    }

    public static ColumnFactory factory(List<RecordingColumn> created)
    {
        return (type, name) -> {
            RecordingColumn column = new RecordingColumn(type, name);
            synchronized (created)
            {
                created.add(column);
            }
            return column;
        };
    }

    @Override
    public ColumnType getType()
    {
        return type;
    }

    @Override
    public synchronized int size()
    {
        return values.size();
    }

    @Override
    protected void doAdd(ColumnVector slice)
    {
        int active = activeWriters.incrementAndGet();
        maxActiveWriters.accumulateAndGet(active, Math::max);
        try
        {
            Thread.sleep(ThreadLocalRandom.current().nextInt(3));
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        synchronized (this)
        {
            for (int i = 0; i < slice.size(); ++i)
            {
                if (slice instanceof FloatColumnVector)
                {
                    values.add(((FloatColumnVector) slice).get(i));
                }
                else
                {
                    values.add(((StringColumnVector) slice).get(i));
                }
            }
        }
        numAdds.incrementAndGet();
        activeWriters.decrementAndGet();
    }

    @Override
    protected void doFinalize()
    {
        numFinalizes.incrementAndGet();
        numAddsAtFinalize = numAdds.get();
    }

    public int getMaxActiveWriters()
    {
        return maxActiveWriters.get();
    }

    public int getNumAdds()
    {
        return numAdds.get();
    }

    public int getNumFinalizes()
    {
        return numFinalizes.get();
    }

    public int getNumAddsAtFinalize()
    {
        return numAddsAtFinalize;
    }

    public synchronized List<Object> getValues()
    {
        return new ArrayList<>(values);
    }
}
