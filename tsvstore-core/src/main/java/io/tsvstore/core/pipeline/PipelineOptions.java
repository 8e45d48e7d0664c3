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

import io.tsvstore.common.utils.ConfigFactory;
import io.tsvstore.common.utils.Constants;
import io.tsvstore.core.column.BinnedFloatColumn;
import io.tsvstore.core.column.ColumnFactory;
import io.tsvstore.core.parser.RowBlockParser;
import io.tsvstore.core.parser.TsvRowBlockParser;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The options of an {@link IngestionPipeline}. One worker count applies to
 * every pool of the pipeline.
 */
public class PipelineOptions
{
    private final int numThreads;
    private final int maxBins;
    private final RowBlockParser parser;
    private final ColumnFactory columnFactory;

    private PipelineOptions(int numThreads, int maxBins, RowBlockParser parser, ColumnFactory columnFactory)
    {
        this.numThreads = numThreads;
        this.maxBins = maxBins;
        this.parser = parser;
        this.columnFactory = columnFactory;
    }

    public int getNumThreads()
    {
        return numThreads;
    }

    public int getMaxBins()
    {
        return maxBins;
    }

    public RowBlockParser getParser()
    {
        return parser;
    }

    public ColumnFactory getColumnFactory()
    {
        return columnFactory;
    }

    @Override
    public String toString()
    {
        return "PipelineOptions{numThreads=" + numThreads + ", maxBins=" + maxBins +
                ", parser=" + parser.getClass().getSimpleName() + "}";
    }

    /**
     * Create a builder whose defaults are the properties in {@link ConfigFactory}.
     */
    public static Builder newBuilder()
    {
        return new Builder(ConfigFactory.Instance());
    }

    public static Builder newBuilder(ConfigFactory configFactory)
    {
        return new Builder(requireNonNull(configFactory, "configFactory is null"));
    }

    public static class Builder
    {
        private final ConfigFactory configFactory;
        private int builderNumThreads;
        private int builderMaxBins;
        private RowBlockParser builderParser = null;
        private ColumnFactory builderColumnFactory = null;

        private Builder(ConfigFactory configFactory)
        {
            this.configFactory = configFactory;
            this.builderNumThreads = Integer.parseInt(
                    configFactory.getProperty(Constants.NUM_THREADS_KEY, "0"));
            this.builderMaxBins = Integer.parseInt(configFactory.getProperty(
                    Constants.BINNED_MAX_BINS_KEY, String.valueOf(Constants.DEFAULT_MAX_BINS)));
        }

        /**
         * @param numThreads the number of threads of every pool, 0 means the number of available processors
         */
        public Builder setNumThreads(int numThreads)
        {
            checkArgument(numThreads >= 0, "numThreads is negative");
            this.builderNumThreads = numThreads;
            return this;
        }

        public Builder setMaxBins(int maxBins)
        {
            this.builderMaxBins = maxBins;
            return this;
        }

        public Builder setParser(RowBlockParser parser)
        {
            this.builderParser = requireNonNull(parser, "parser is null");
            return this;
        }

        /**
         * Set the factory of the columns, the max bins option is ignored if it is set.
         */
        public Builder setColumnFactory(ColumnFactory columnFactory)
        {
            this.builderColumnFactory = requireNonNull(columnFactory, "columnFactory is null");
            return this;
        }

        public PipelineOptions build()
        {
            checkArgument(builderNumThreads >= 0, "numThreads is negative");
            checkArgument(builderMaxBins > 0 && builderMaxBins <= BinnedFloatColumn.MAX_BINS_LIMIT,
                    "maxBins must be in [1, %s]", BinnedFloatColumn.MAX_BINS_LIMIT);
            int numThreads = builderNumThreads > 0 ? builderNumThreads : Runtime.getRuntime().availableProcessors();
            RowBlockParser parser = builderParser != null ? builderParser : TsvRowBlockParser.fromConfig(configFactory);
            ColumnFactory columnFactory = builderColumnFactory != null ?
                    builderColumnFactory : ColumnFactory.withMaxBins(builderMaxBins);
            return new PipelineOptions(numThreads, builderMaxBins, parser, columnFactory);
        }
    }
}
