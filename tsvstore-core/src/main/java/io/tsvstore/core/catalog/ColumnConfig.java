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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.tsvstore.common.exception.InvalidConfigException;
import io.tsvstore.common.utils.ConfigFactory;
import io.tsvstore.common.utils.Constants;
import io.tsvstore.core.column.ColumnType;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * The columns to load: three ordered lists of column names, one for each column type.
 * The order of declaration decides the layout of the row blocks.
 */
public class ColumnConfig
{
    private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private final List<String> binnedFloatColumns;
    private final List<String> rawFloatColumns;
    private final List<String> stringColumns;

    private ColumnConfig(List<String> binnedFloatColumns, List<String> rawFloatColumns, List<String> stringColumns)
    {
        this.binnedFloatColumns = ImmutableList.copyOf(binnedFloatColumns);
        this.rawFloatColumns = ImmutableList.copyOf(rawFloatColumns);
        this.stringColumns = ImmutableList.copyOf(stringColumns);
    }

    public List<String> getBinnedFloatColumns()
    {
        return binnedFloatColumns;
    }

    public List<String> getRawFloatColumns()
    {
        return rawFloatColumns;
    }

    public List<String> getStringColumns()
    {
        return stringColumns;
    }

    public List<String> getColumns(ColumnType type)
    {
        switch (requireNonNull(type, "type is null"))
        {
            case BINNED_FLOAT:
                return binnedFloatColumns;
            case RAW_FLOAT:
                return rawFloatColumns;
            case STRING:
                return stringColumns;
            default:
                throw new IllegalArgumentException("unknown column type: " + type);
        }
    }

    public int getNumColumns()
    {
        return binnedFloatColumns.size() + rawFloatColumns.size() + stringColumns.size();
    }

    /**
     * Check that no column name is empty and no column name is declared more than once,
     * either in one list or across the lists.
     * @throws InvalidConfigException if the check fails
     */
    public void validate() throws InvalidConfigException
    {
        Map<String, ColumnType> declared = new HashMap<>();
        for (ColumnType type : ColumnType.values())
        {
            for (String name : getColumns(type))
            {
                if (name.isEmpty())
                {
                    throw new InvalidConfigException("empty column name in " + type + " columns");
                }
                ColumnType previous = declared.put(name, type);
                if (previous != null)
                {
                    throw new InvalidConfigException("column '" + name + "' is declared more than once, as " +
                            previous + (previous == type ? " again" : " and as " + type));
                }
            }
        }
    }

    /**
     * Read the column lists from the comma separated properties
     * columns.binned.float, columns.raw.float, and columns.string.
     */
    public static ColumnConfig fromProperties(Properties properties)
    {
        requireNonNull(properties, "properties is null");
        return newBuilder()
                .addBinnedFloatColumns(NAME_SPLITTER.splitToList(
                        properties.getProperty(Constants.BINNED_FLOAT_COLUMNS_KEY, "")))
                .addRawFloatColumns(NAME_SPLITTER.splitToList(
                        properties.getProperty(Constants.RAW_FLOAT_COLUMNS_KEY, "")))
                .addStringColumns(NAME_SPLITTER.splitToList(
                        properties.getProperty(Constants.STRING_COLUMNS_KEY, "")))
                .build();
    }

    public static ColumnConfig fromConfigFactory(ConfigFactory configFactory)
    {
        requireNonNull(configFactory, "configFactory is null");
        Properties properties = new Properties();
        for (String key : Arrays.asList(Constants.BINNED_FLOAT_COLUMNS_KEY,
                Constants.RAW_FLOAT_COLUMNS_KEY, Constants.STRING_COLUMNS_KEY))
        {
            properties.setProperty(key, configFactory.getProperty(key, ""));
        }
        return fromProperties(properties);
    }

    /**
     * Split a comma separated list of column names.
     */
    public static List<String> splitNames(String names)
    {
        return names == null ? ImmutableList.of() : NAME_SPLITTER.splitToList(names);
    }

    @Override
    public String toString()
    {
        return "ColumnConfig{binnedFloat=" + binnedFloatColumns + ", rawFloat=" + rawFloatColumns +
                ", string=" + stringColumns + "}";
    }

    public static Builder newBuilder()
    {
        return new Builder();
    }

    public static class Builder
    {
        private final ImmutableList.Builder<String> builderBinnedFloatColumns = ImmutableList.builder();
        private final ImmutableList.Builder<String> builderRawFloatColumns = ImmutableList.builder();
        private final ImmutableList.Builder<String> builderStringColumns = ImmutableList.builder();

        private Builder()
        {
        }

        public Builder addBinnedFloatColumns(String... names)
        {
            return addBinnedFloatColumns(Arrays.asList(names));
        }

        public Builder addBinnedFloatColumns(List<String> names)
        {
            this.builderBinnedFloatColumns.addAll(requireNonNull(names));
            return this;
        }

        public Builder addRawFloatColumns(String... names)
        {
            return addRawFloatColumns(Arrays.asList(names));
        }

        public Builder addRawFloatColumns(List<String> names)
        {
            this.builderRawFloatColumns.addAll(requireNonNull(names));
            return this;
        }

        public Builder addStringColumns(String... names)
        {
            return addStringColumns(Arrays.asList(names));
        }

        public Builder addStringColumns(List<String> names)
        {
            this.builderStringColumns.addAll(requireNonNull(names));
            return this;
        }

        public ColumnConfig build()
        {
            return new ColumnConfig(builderBinnedFloatColumns.build(),
                    builderRawFloatColumns.build(), builderStringColumns.build());
        }
    }
}
