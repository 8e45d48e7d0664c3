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
 * The float counterpart of {@link DynamicIntArray}, not synchronized either.
 */
public final class DynamicFloatArray
{
    static final int DEFAULT_CHUNKSIZE = 8 * 1024;
    static final int INIT_CHUNKS = 128;

    private final int chunkSize;       // our allocation size
    private float[][] data;            // the real data
    private int length;                // max set element index +1
    private int initializedChunks = 0; // the number of created chunks

    public DynamicFloatArray()
    {
        this(DEFAULT_CHUNKSIZE);
    }

    public DynamicFloatArray(int chunkSize)
    {
        this.chunkSize = chunkSize;
        data = new float[INIT_CHUNKS][];
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
                data[i] = new float[chunkSize];
            }
            initializedChunks = chunkIndex + 1;
        }
    }

    public float get(int index)
    {
        if (index < 0 || index >= length)
        {
            throw new IndexOutOfBoundsException("Index " + index + " is outside of 0.." + (length - 1));
        }
        return data[index / chunkSize][index % chunkSize];
    }

    public void add(float value)
    {
        int i = length / chunkSize;
        int j = length % chunkSize;
        grow(i);
        data[i][j] = value;
        length += 1;
    }

    /**
     * Append the first {@code num} values of the given array.
     */
    public void addAll(float[] values, int num)
    {
        int copied = 0;
        while (copied < num)
        {
            int i = length / chunkSize;
            int j = length % chunkSize;
            grow(i);
            int n = Math.min(chunkSize - j, num - copied);
            System.arraycopy(values, copied, data[i], j, n);
            copied += n;
            length += n;
        }
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
    public float[] toArray()
    {
        float[] array = new float[length];
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
