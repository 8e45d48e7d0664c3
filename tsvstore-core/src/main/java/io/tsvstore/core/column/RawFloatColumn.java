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

import io.tsvstore.core.utils.DynamicFloatArray;
import io.tsvstore.core.vector.ColumnVector;
import io.tsvstore.core.vector.FloatColumnVector;

import java.util.Arrays;

/**
 * A float column that keeps the values as they are. Missing values are NaN.
 */
public final class RawFloatColumn extends Column
{
    private DynamicFloatArray buffer = new DynamicFloatArray();
    private float[] values = null;

    RawFloatColumn(String name)
    {
        super(name);
    }

    @Override
    public ColumnType getType()
    {
        return ColumnType.RAW_FLOAT;
    }

    @Override
    protected void doAdd(ColumnVector slice)
    {
        FloatColumnVector floats = (FloatColumnVector) slice;
        buffer.addAll(floats.vector, floats.size());
    }

    @Override
    protected void doFinalize()
    {
        values = buffer.toArray();
        buffer = null;
    }

    @Override
    public int size()
    {
        return values != null ? values.length : buffer.size();
    }

    public float get(int row)
    {
        checkReadable();
        return values[row];
    }

    /**
     * @return a copy of the values of this column
     */
    public float[] getValues()
    {
        checkReadable();
        return Arrays.copyOf(values, values.length);
    }
}
