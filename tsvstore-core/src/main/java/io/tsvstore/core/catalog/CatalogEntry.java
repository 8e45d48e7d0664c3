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
package io.tsvstore.core.catalog;

import io.tsvstore.core.column.Column;
import io.tsvstore.core.vector.ColumnVector;
import io.tsvstore.core.vector.RowBlock;

import static java.util.Objects.requireNonNull;

/**
 * A configured column: its name, its column, and its position in the
 * float vectors or the string vectors of every row block.
 */
public final class CatalogEntry
{
    private final String name;
    private final Column column;
    private final int position;
    private final int headerPosition;

    CatalogEntry(String name, Column column, int position, int headerPosition)
    {
        this.name = requireNonNull(name, "name is null");
        this.column = requireNonNull(column, "column is null");
        this.position = position;
        this.headerPosition = headerPosition;
    }

    public String getName()
    {
        return name;
    }

    public Column getColumn()
    {
        return column;
    }

    /**
     * @return the position in the type-homogeneous vectors of a row block
     */
    public int getPosition()
    {
        return position;
    }

    /**
     * @return the position of the field in a line of the data files
     */
    public int getHeaderPosition()
    {
        return headerPosition;
    }

    /**
     * @return the vector of this column in the row block
     */
    public ColumnVector sliceOf(RowBlock block)
    {
        return column.getType().isFloat() ? block.getFloatColumn(position) : block.getStringColumn(position);
    }

    @Override
    public String toString()
    {
        return name + "(" + column.getType() + ", position=" + position + ", field=" + headerPosition + ")";
    }
}
