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

import java.util.Arrays;

/**
 * Dynamic int array that uses primitive types and chunks to avoid copying
 * large number of integers when it resizes.
 * <p>
 * The values of a column are appended block by block and the final number of
 * values is unknown until all blocks are added, so the chunks are only
 * concatenated once in {@link #toArray()}.
 * <p>
 * NOTE: Like standard Collection implementations/arrays, this class is not
 * synchronized.
 */
public final class DynamicIntArray
{
    static final int DEFAULT_CHUNKSIZE = 8 * 1024;
    static final int INIT_CHUNKS = 128;

    private final int chunkSize;       // our allocation size
    private int[][] data;              // the real data
    private int length;                // max set element index +1
    private int initializedChunks = 0; // the number of created chunks

    public DynamicIntArray()
    {
        this(DEFAULT_CHUNKSIZE);
    }

    public DynamicIntArray(int chunkSize)
    {
        this.chunkSize = chunkSize;
        data = new int[INIT_CHUNKS][];
    }

    private void grow(int chunkIndex)
    {
        if (chunkIndex >= initializedChunks)
        {
            if (chunkIndex >= data.length)
            {
                int newSize = Math.max(chunkIndex + 1, 2 * data.length);
                data = Arrays.copyOf(data, newSize);
            }
            for (int i = initializedChunks; i <= chunkIndex; ++i)
            {
                data[i] = new int[chunkSize];
            }
            initializedChunks = chunkIndex + 1;
        }
    }

    public int get(int index)
    {
        if (index < 0 || index >= length)
        {
            throw new IndexOutOfBoundsException("Index " + index + " is outside of 0.." + (length - 1));
        }
        return data[index / chunkSize][index % chunkSize];
    }

    public void add(int value)
    {
        int i = length / chunkSize;
        int j = length % chunkSize;
        grow(i);
        data[i][j] = value;
        length += 1;
    }

    public int size()
    {
        return length;
    }

    public void clear()
    {
        length = 0;
        Arrays.fill(data, null);
        initializedChunks = 0;
    }

    /**
     * Concatenate the chunks into an array of exactly {@link #size()} elements.
     */
    public int[] toArray()
    {
        int[] array = new int[length];
        int copied = 0;
        for (int i = 0; copied < length; ++i)
        {
            int n = Math.min(chunkSize, length - copied);
            System.arraycopy(data[i], 0, array, copied, n);
            copied += n;
        }
        return array;
    }
}
