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
package io.tsvstore.core.vector;

import java.util.Arrays;

/**
 * This class represents a string column vector. The values are kept as
 * they are in the text file, empty fields included.
 */
public class StringColumnVector extends ColumnVector
{
    public String[] vector;

    public StringColumnVector()
    {
        this(RowBlock.DEFAULT_SIZE);
    }

    public StringColumnVector(int len)
    {
        super(len);
        vector = new String[len];
    }

    @Override
    public void add(String value)
    {
        if (writeIndex >= getLength())
        {
            ensureSize(Math.max(writeIndex * 2, 16), true);
        }
        vector[writeIndex++] = value;
    }

    /**
     * String columns do not distinguish missing values, a missing field is an empty string.
     */
    @Override
    public void addNull()
    {
        add("");
    }

    public String get(int row)
    {
        return vector[row];
    }

    @Override
    public Type getType()
    {
        return Type.STRING;
    }

    @Override
    public void ensureSize(int size, boolean preserveData)
    {
        if (size > vector.length)
        {
            String[] oldArray = vector;
            vector = new String[size];
            length = size;
            if (preserveData)
            {
                System.arraycopy(oldArray, 0, vector, 0, writeIndex);
            }
        }
    }

    @Override
    public void stringifyValue(StringBuilder buffer, int row)
    {
        buffer.append('"').append(vector[row]).append('"');
    }

    @Override
    public void reset()
    {
        Arrays.fill(vector, 0, writeIndex, null);
        super.reset();
    }

    @Override
    public String toString()
    {
        return Arrays.toString(Arrays.copyOf(vector, writeIndex));
    }
}
