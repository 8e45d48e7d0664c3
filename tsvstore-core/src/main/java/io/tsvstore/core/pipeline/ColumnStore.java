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
package io.tsvstore.core.pipeline;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.tsvstore.core.column.BinnedFloatColumn;
import io.tsvstore.core.column.Column;
import io.tsvstore.core.column.ColumnType;
import io.tsvstore.core.column.RawFloatColumn;
import io.tsvstore.core.column.StringColumn;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The result of a load: the finalized columns by name. It has no mutation
 * methods, and the columns in it are read-only.
 */
public class ColumnStore
{
    private final Map<String, Column> columns;
    private final List<String> dataFiles;
    private final int numRows;

    ColumnStore(Map<String, Column> columns, List<String> dataFiles, int numRows)
    {
        this.columns = ImmutableMap.copyOf(requireNonNull(columns, "columns is null"));
        this.dataFiles = ImmutableList.copyOf(requireNonNull(dataFiles, "dataFiles is null"));
        this.numRows = numRows;
        for (Column column : this.columns.values())
        {
            checkArgument(column.isFinalized(), "column %s is not finalized", column.getName());
        }
    }

    /**
     * @return the number of rows, i.e., the number of values in every column
     */
    public int getNumRows()
    {
        return numRows;
    }

    public int getNumColumns()
    {
        return columns.size();
    }

    /**
     * @return the column names in the order of declaration, float columns first
     */
    public Set<String> getColumnNames()
    {
        return columns.keySet();
    }

    /**
     * @return the paths of the loaded data files, in the order they are loaded
     */
    public List<String> getDataFiles()
    {
        return dataFiles;
    }

    public boolean containsColumn(String name)
    {
        return columns.containsKey(name);
    }

    /**
     * @return the column, or null if the column is not loaded
     */
    public Column getColumn(String name)
    {
        return columns.get(name);
    }

    public Map<String, Column> getColumns()
    {
        return columns;
    }

    public BinnedFloatColumn getBinnedFloatColumn(String name)
    {
        return (BinnedFloatColumn) getColumn(name, ColumnType.BINNED_FLOAT);
    }

    public RawFloatColumn getRawFloatColumn(String name)
    {
        return (RawFloatColumn) getColumn(name, ColumnType.RAW_FLOAT);
    }

    public StringColumn getStringColumn(String name)
    {
        return (StringColumn) getColumn(name, ColumnType.STRING);
    }

    private Column getColumn(String name, ColumnType type)
    {
        Column column = columns.get(name);
        checkArgument(column != null, "column %s is not loaded", name);
        checkArgument(column.getType() == type, "column %s is %s, not %s", name, column.getType(), type);
        return column;
    }

    /**
     * @return a human readable summary of the columns
     */
    public String describe()
    {
        StringBuilder builder = new StringBuilder();
        builder.append(numRows).append(" rows from ").append(dataFiles.size())
                .append(" files, ").append(columns.size()).append(" columns");
        for (Column column : columns.values())
        {
            builder.append('\n').append("  ").append(column.getName()).append('\t').append(column.getType());
            switch (column.getType())
            {
                case BINNED_FLOAT:
                    builder.append("\tbins: ").append(((BinnedFloatColumn) column).getNumBins());
                    break;
                case STRING:
                    builder.append("\tdistinct values: ").append(((StringColumn) column).getDictionarySize());
                    break;
                default:
                    break;
            }
        }
        return builder.toString();
    }

    @Override
    public String toString()
    {
        return "ColumnStore{numRows=" + numRows + ", columns=" + columns.keySet() + "}";
    }
}
