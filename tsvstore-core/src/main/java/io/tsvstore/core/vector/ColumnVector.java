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

/**
 * ColumnVector holds the values of one column of one row block.
 * <p>
 * Values are appended one by one by the parser with {@link #add(String)} and
 * the vector grows when it is full. The fields are public since this is a
 * performance-critical structure that is read in the inner loop of column
 * population.
 */
public abstract class ColumnVector
{
    /**
     * length is the capacity, i.e., maximum number of values, of this column vector
     * <b>DO NOT</b> use it as the number of values in-used.
     */
    int length;
    int writeIndex = 0;

    /**
     * The current kinds of column vectors.
     */
    public enum Type
    {
        FLOAT,
        STRING
    }

    public ColumnVector(int len)
    {
        this.length = len;
    }

    /**
     * Parse and append the value of a field.
     * @param value the text of the field
     */
    public abstract void add(String value);

    /**
     * Append a missing value.
     */
    public abstract void addNull();

    public abstract Type getType();

    /**
     * @return the capacity of this column vector
     */
    public int getLength()
    {
        return length;
    }

    /**
     * @return the number of values added into this column vector
     */
    public int size()
    {
        return writeIndex;
    }

    /**
     * Ensure the ColumnVector can hold at least size values.
     *
     * @param size the new minimum size
     * @param preserveData should the old data be preserved?
     */
    public abstract void ensureSize(int size, boolean preserveData);

    /**
     * Print the value for this column into the given string builder.
     *
     * @param buffer the buffer to print into
     * @param row the id of the row to print
     */
    public abstract void stringifyValue(StringBuilder buffer, int row);

    public void reset()
    {
        writeIndex = 0;
    }
}
