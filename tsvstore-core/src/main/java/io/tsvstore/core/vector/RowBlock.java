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

import javax.annotation.concurrent.NotThreadSafe;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * A RowBlock is the parsed content of exactly one input file, organized with
 * each column as a vector. Float-typed columns and string columns are kept in
 * two separate arrays and addressed by their positions in these arrays, not
 * by their names.
 * <p>
 * A row block is created by the parse task of its file, handed over to the
 * loading thread once, read by the fan-out tasks, and then dropped.
 */
@NotThreadSafe
public class RowBlock
{
    /*
     * The initial capacity of the column vectors created by the parser.
     */
    public static final int DEFAULT_SIZE = 1024;

    private final String path;
    private final FloatColumnVector[] floatColumns;
    private final StringColumnVector[] stringColumns;
    private int numRows;

    public RowBlock(String path, int numFloatColumns, int numStringColumns)
    {
        this(path, numFloatColumns, numStringColumns, DEFAULT_SIZE);
    }

    public RowBlock(String path, int numFloatColumns, int numStringColumns, int capacity)
    {
        this.path = requireNonNull(path, "path is null");
        checkArgument(numFloatColumns >= 0 && numStringColumns >= 0, "number of columns is negative");
        this.floatColumns = new FloatColumnVector[numFloatColumns];
        this.stringColumns = new StringColumnVector[numStringColumns];
        for (int i = 0; i < numFloatColumns; ++i)
        {
            floatColumns[i] = new FloatColumnVector(capacity);
        }
        for (int i = 0; i < numStringColumns; ++i)
        {
            stringColumns[i] = new StringColumnVector(capacity);
        }
        this.numRows = 0;
    }

    /**
     * @return the path of the file this block is parsed from
     */
    public String getPath()
    {
        return path;
    }

    public int getNumFloatColumns()
    {
        return floatColumns.length;
    }

    public int getNumStringColumns()
    {
        return stringColumns.length;
    }

    public FloatColumnVector getFloatColumn(int position)
    {
        checkElementIndex(position, floatColumns.length, "float column position");
        return floatColumns[position];
    }

    public StringColumnVector getStringColumn(int position)
    {
        checkElementIndex(position, stringColumns.length, "string column position");
        return stringColumns[position];
    }

    /**
     * Called by the parser after the fields of a row are added into all the column vectors.
     */
    public void finishRow()
    {
        numRows++;
    }

    public int getNumRows()
    {
        return numRows;
    }

    public boolean isEmpty()
    {
        return numRows == 0;
    }

    /**
     * Check that every column vector holds exactly {@link #getNumRows()} values.
     * @return true if the row counts are consistent
     */
    public boolean isConsistent()
    {
        for (ColumnVector column : floatColumns)
        {
            if (column.size() != numRows)
            {
                return false;
            }
        }
        for (ColumnVector column : stringColumns)
        {
            if (column.size() != numRows)
            {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString()
    {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < numRows; i++)
        {
            b.append('[');
            for (int k = 0; k < floatColumns.length; k++)
            {
                if (k > 0)
                {
                    b.append(", ");
                }
                floatColumns[k].stringifyValue(b, i);
            }
            for (int k = 0; k < stringColumns.length; k++)
            {
                if (k > 0 || floatColumns.length > 0)
                {
                    b.append(", ");
                }
                stringColumns[k].stringifyValue(b, i);
            }
            b.append(']');
            if (i < numRows - 1)
            {
                b.append('\n');
            }
        }
        return b.toString();
    }
}
