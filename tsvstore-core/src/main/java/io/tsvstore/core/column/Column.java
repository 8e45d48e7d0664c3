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

import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A column of the store. It accumulates the values of one configured column,
 * row block by row block, until it is finalized. After that it is read-only.
 * <p>
 * The variants of columns are {@link BinnedFloatColumn}, {@link RawFloatColumn}
 * and {@link StringColumn}; the constructor is package private so that no other
 * variant can be added outside this package. Use {@link #newColumn(ColumnType, String, int)}
 * to create a column.
 * </p>
 * <p>
 * A column is not synchronized. Different columns can be populated concurrently,
 * but for one column, {@link #add(ColumnVector)} and {@link #finalizeColumn()}
 * must be called by one thread at a time, in order. A second thread entering a
 * column that is being written fails with {@link IllegalStateException}.
 * </p>
 */
public abstract class Column
{
    private final String name;
    private final AtomicReference<Thread> writer = new AtomicReference<>(null);
    private volatile boolean finalized = false;

    Column(String name)
    {
        this.name = requireNonNull(name, "name is null");
    }

    public static Column newColumn(ColumnType type, String name, int maxBins)
    {
        requireNonNull(type, "type is null");
        switch (type)
        {
            case BINNED_FLOAT:
                return new BinnedFloatColumn(name, maxBins);
            case RAW_FLOAT:
                return new RawFloatColumn(name);
            case STRING:
                return new StringColumn(name);
            default:
                throw new IllegalArgumentException("unknown column type: " + type);
        }
    }

    public String getName()
    {
        return name;
    }

    public abstract ColumnType getType();

    /**
     * @return the number of values in this column
     */
    public abstract int size();

    public boolean isFinalized()
    {
        return finalized;
    }

    /**
     * Append the values of a row block vector to this column.
     * @param slice the vector of this column in a row block
     * @throws IllegalStateException if this column is finalized or is being written by another thread
     */
    public final void add(ColumnVector slice)
    {
        requireNonNull(slice, "slice is null");
        checkArgument(slice.getType() == getType().getVectorType(),
                "column %s of type %s can not be populated from a %s vector", name, getType(), slice.getType());
        enter();
        try
        {
            checkState(!finalized, "column %s is finalized", name);
            doAdd(slice);
        }
        finally
        {
            exit();
        }
    }

    /**
     * Freeze this column. Must be called exactly once, after the last {@link #add(ColumnVector)}.
     * @throws IllegalStateException if this column is already finalized or is being written by another thread
     */
    public final void finalizeColumn()
    {
        enter();
        try
        {
            checkState(!finalized, "column %s is finalized more than once", name);
            doFinalize();
            finalized = true;
        }
        finally
        {
            exit();
        }
    }

    protected abstract void doAdd(ColumnVector slice);

    protected abstract void doFinalize();

    /**
     * Readers call this before reading the finalized representation.
     */
    protected void checkReadable()
    {
        checkState(finalized, "column %s is not finalized yet", name);
    }

    private void enter()
    {
        Thread current = Thread.currentThread();
        Thread other = writer.get();
        checkState(writer.compareAndSet(null, current),
                "column %s is written by %s and %s concurrently", name,
                other == null ? "another thread" : other.getName(), current.getName());
    }

    private void exit()
    {
        writer.set(null);
    }

    @Override
    public String toString()
    {
        return getType() + "(" + name + ", " + size() + " values" + (finalized ? ", finalized)" : ")");
    }
}
