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
 * This class represents a float column vector. A missing value is stored as
 * {@link #NULL_VALUE}, there is no separate null flag.
 * <p>
 * The vector[] field is public for high-performance access in the inner
 * loop of column population.
 */
public class FloatColumnVector extends ColumnVector
{
    public float[] vector;
    public static final float NULL_VALUE = Float.NaN;

    public FloatColumnVector()
    {
        this(RowBlock.DEFAULT_SIZE);
    }

    public FloatColumnVector(int len)
    {
        super(len);
        vector = new float[len];
    }

    /**
     * Parse and append a decimal float, e.g., 1.5, -2e3, NaN or Infinity. The Java
     * literal forms that {@link Float#parseFloat(String)} also accepts, i.e., a trailing
     * f, F, d or D and hexadecimal floats, are rejected.
     * @throws NumberFormatException if the value is not a decimal float
     */
    @Override
    public void add(String value)
    {
        if (!value.isEmpty())
        {
            char last = value.charAt(value.length() - 1);
            if (last == 'f' || last == 'F' || last == 'd' || last == 'D' ||
                    value.indexOf('x') >= 0 || value.indexOf('X') >= 0)
            {
                throw new NumberFormatException("not a decimal float: \"" + value + "\"");
            }
        }
        add(Float.parseFloat(value));
    }

    public void add(float value)
    {
        if (writeIndex >= getLength())
        {
            ensureSize(Math.max(writeIndex * 2, 16), true);
        }
        vector[writeIndex++] = value;
    }

    @Override
    public void addNull()
    {
        add(NULL_VALUE);
    }

    public float get(int row)
    {
        return vector[row];
    }

    @Override
    public Type getType()
    {
        return Type.FLOAT;
    }

    @Override
    public void ensureSize(int size, boolean preserveData)
    {
        if (size > vector.length)
        {
            float[] oldArray = vector;
            vector = new float[size];
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
        if (Float.isNaN(vector[row]))
        {
            buffer.append("null");
        }
        else
        {
            buffer.append(vector[row]);
        }
    }

    @Override
    public String toString()
    {
        return Arrays.toString(Arrays.copyOf(vector, writeIndex));
    }
}
