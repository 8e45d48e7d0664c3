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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.tsvstore.common.exception.ColumnResolutionException;
import io.tsvstore.common.exception.InvalidConfigException;
import io.tsvstore.core.column.Column;
import io.tsvstore.core.column.ColumnFactory;
import io.tsvstore.core.column.ColumnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The catalog of the columns to load. It is built once from the header and the
 * column configuration, and is immutable afterwards.
 * <p>
 * Binned and raw float columns share one position space, in which the binned columns
 * come first and then the raw columns, each in the order of declaration. String columns
 * have a separate position space. The parser lays out the vectors of every row block
 * in these orders, by the field positions from {@link #getFloatFieldPositions()} and
 * {@link #getStringFieldPositions()}.
 * </p>
 */
public class ColumnCatalog
{
    private static final Logger logger = LogManager.getLogger(ColumnCatalog.class);

    private final List<CatalogEntry> floatEntries;
    private final List<CatalogEntry> stringEntries;
    private final List<CatalogEntry> entries;
    private final Map<String, Column> columns;
    private final int[] floatFieldPositions;
    private final int[] stringFieldPositions;

    private ColumnCatalog(List<CatalogEntry> floatEntries, List<CatalogEntry> stringEntries)
    {
        this.floatEntries = ImmutableList.copyOf(floatEntries);
        this.stringEntries = ImmutableList.copyOf(stringEntries);
        this.entries = ImmutableList.<CatalogEntry>builder().addAll(floatEntries).addAll(stringEntries).build();
        ImmutableMap.Builder<String, Column> builder = ImmutableMap.builder();
        for (CatalogEntry entry : this.entries)
        {
            builder.put(entry.getName(), entry.getColumn());
        }
        this.columns = builder.build();
        this.floatFieldPositions = floatEntries.stream().mapToInt(CatalogEntry::getHeaderPosition).toArray();
        this.stringFieldPositions = stringEntries.stream().mapToInt(CatalogEntry::getHeaderPosition).toArray();
    }

    /**
     * Resolve the configured columns against the header and create the columns.
     * @param header the header index
     * @param config the column configuration
     * @param columnFactory the factory creating the columns
     * @return the catalog
     * @throws ColumnResolutionException if a configured column is not in the header
     * @throws InvalidConfigException if a column is declared more than once, or the
     * column factory returns a column of another type than the declared one
     */
    public static ColumnCatalog build(HeaderIndex header, ColumnConfig config, ColumnFactory columnFactory)
            throws InvalidConfigException
    {
        requireNonNull(header, "header is null");
        requireNonNull(config, "config is null");
        requireNonNull(columnFactory, "columnFactory is null");
        config.validate();

        ImmutableList.Builder<CatalogEntry> floatEntries = ImmutableList.builder();
        ImmutableList.Builder<CatalogEntry> stringEntries = ImmutableList.builder();
        int numFloat = 0, numString = 0;
        // BINNED_FLOAT is declared before RAW_FLOAT in ColumnType
        for (ColumnType type : ColumnType.values())
        {
            for (String name : config.getColumns(type))
            {
                int headerPosition = header.getPosition(name);
                if (headerPosition < 0)
                {
                    throw new ColumnResolutionException(name);
                }
                Column column = requireNonNull(columnFactory.create(type, name),
                        "column factory returns null for " + name);
                if (column.getType() != type)
                {
                    throw new InvalidConfigException("column factory returns a " + column.getType() +
                            " column for column " + name + " declared as " + type);
                }
                if (type.isFloat())
                {
                    floatEntries.add(new CatalogEntry(name, column, numFloat++, headerPosition));
                }
                else
                {
                    stringEntries.add(new CatalogEntry(name, column, numString++, headerPosition));
                }
            }
        }
        ColumnCatalog catalog = new ColumnCatalog(floatEntries.build(), stringEntries.build());
        logger.debug("column catalog is built: " + catalog.entries);
        return catalog;
    }

    /**
     * @return the float column entries, ordered by their positions
     */
    public List<CatalogEntry> getFloatEntries()
    {
        return floatEntries;
    }

    /**
     * @return the string column entries, ordered by their positions
     */
    public List<CatalogEntry> getStringEntries()
    {
        return stringEntries;
    }

    /**
     * @return all the entries, float entries first
     */
    public List<CatalogEntry> getEntries()
    {
        return entries;
    }

    /**
     * @return the columns by name, in the order of declaration
     */
    public Map<String, Column> getColumns()
    {
        return columns;
    }

    public int getNumFloatColumns()
    {
        return floatEntries.size();
    }

    public int getNumStringColumns()
    {
        return stringEntries.size();
    }

    /**
     * @return the field position in the data files of each float column, indexed by float position
     */
    public int[] getFloatFieldPositions()
    {
        return floatFieldPositions.clone();
    }

    /**
     * @return the field position in the data files of each string column, indexed by string position
     */
    public int[] getStringFieldPositions()
    {
        return stringFieldPositions.clone();
    }
}
