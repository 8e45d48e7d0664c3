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

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import io.tsvstore.common.exception.LoadFailedException;
import io.tsvstore.common.exception.MissingInputException;
import io.tsvstore.common.exception.RowBlockParseException;
import io.tsvstore.common.exception.TsvStoreException;
import io.tsvstore.core.catalog.CatalogEntry;
import io.tsvstore.core.catalog.ColumnCatalog;
import io.tsvstore.core.catalog.ColumnConfig;
import io.tsvstore.core.catalog.HeaderIndex;
import io.tsvstore.core.column.Column;
import io.tsvstore.core.parser.RowBlockParser;
import io.tsvstore.core.utils.BlockingSlots;
import io.tsvstore.core.utils.WorkerPool;
import io.tsvstore.core.vector.RowBlock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * Loads a list of tsv files into a {@link ColumnStore}.
 * <p>
 * A load runs in three phases on two worker pools that are created for the load
 * and closed when it ends:
 * <ol>
 *     <li>parse: one task per data file on the parse pool, each putting its
 *     {@link RowBlock} into the slot of the file;</li>
 *     <li>fan-out: the loading thread takes the blocks in the order of the data files,
 *     and adds each block into every column on the column pool, waiting for all the
 *     columns before taking the next block;</li>
 *     <li>finalize: after the last block, every column is finalized on the column pool.</li>
 * </ol>
 * Parsing overlaps the fan-out, the number of blocks parsed ahead is bounded by the
 * size of the parse pool. Any failure aborts the load with the first error, there
 * is no partial store.
 * </p>
 */
public class IngestionPipeline
{
    private static final Logger logger = LogManager.getLogger(IngestionPipeline.class);

    public static final String PARSE_POOL_NAME = "tsvstore-parse";
    public static final String COLUMN_POOL_NAME = "tsvstore-column";

    private final PipelineOptions options;

    public IngestionPipeline(PipelineOptions options)
    {
        this.options = requireNonNull(options, "options is null");
    }

    public PipelineOptions getOptions()
    {
        return options;
    }

    /**
     * Load the data files.
     * @param headerFile the file whose first line is the tab-delimited column names of the data files
     * @param dataFiles the data files, loaded in this order
     * @param config the columns to load
     * @return the store of the finalized columns
     * @throws MissingInputException if the header file or a data file does not exist,
     * nothing is started in this case
     * @throws io.tsvstore.common.exception.InvalidConfigException if the config is invalid
     * or a configured column is not in the header
     * @throws RowBlockParseException if a data file is malformed
     * @throws LoadFailedException if the load fails for any other reason
     */
    public ColumnStore load(Path headerFile, List<Path> dataFiles, ColumnConfig config) throws TsvStoreException
    {
        requireNonNull(headerFile, "headerFile is null");
        requireNonNull(dataFiles, "dataFiles is null");
        requireNonNull(config, "config is null");
        List<Path> files = ImmutableList.copyOf(dataFiles);

        Stopwatch stopwatch = Stopwatch.createStarted();
        checkInputs(headerFile, files);
        HeaderIndex header;
        try
        {
            header = HeaderIndex.fromFile(headerFile);
        }
        catch (IOException e)
        {
            throw new LoadFailedException("failed to read header file '" + headerFile + "'", e);
        }
        ColumnCatalog catalog = ColumnCatalog.build(header, config, options.getColumnFactory());
        logger.info("loading " + files.size() + " files into " + catalog.getEntries().size() +
                " columns with " + options.getNumThreads() + " threads per pool");

        long numRows = 0;
        try (WorkerPool parsePool = new WorkerPool(PARSE_POOL_NAME, options.getNumThreads());
             WorkerPool columnPool = new WorkerPool(COLUMN_POOL_NAME, options.getNumThreads()))
        {
            BlockingSlots<RowBlock> slots = new BlockingSlots<>(files.size());
            startParsing(parsePool, catalog, files, slots);

            for (int i = 0; i < files.size(); ++i)
            {
                RowBlock block = takeBlock(slots, i);
                fanOut(columnPool, catalog, block);
                numRows += block.getNumRows();
                if (numRows > Integer.MAX_VALUE)
                {
                    throw new LoadFailedException("too many rows, a column holds at most " +
                            Integer.MAX_VALUE + " values");
                }
                logger.info("processed block " + (i + 1) + "/" + files.size() + " from '" +
                        block.getPath() + "', " + block.getNumRows() + " rows");
            }
            logger.info("parsed and added " + numRows + " rows in " +
                    stopwatch.elapsed(TimeUnit.MILLISECONDS) + " ms");

            stopwatch.reset().start();
            finalizeColumns(columnPool, catalog);
            logger.info("finalized " + catalog.getEntries().size() + " columns in " +
                    stopwatch.elapsed(TimeUnit.MILLISECONDS) + " ms");
        }
        catch (TsvStoreException e)
        {
            logger.error("failed to load " + files.size() + " files", e);
            throw e;
        }

        List<String> paths = new ArrayList<>(files.size());
        for (Path file : files)
        {
            paths.add(file.toString());
        }
        return new ColumnStore(catalog.getColumns(), paths, (int) numRows);
    }

    private static void checkInputs(Path headerFile, List<Path> dataFiles) throws MissingInputException
    {
        if (!Files.isRegularFile(headerFile))
        {
            throw new MissingInputException(headerFile.toString());
        }
        for (Path file : dataFiles)
        {
            if (!Files.isRegularFile(requireNonNull(file, "data file is null")))
            {
                throw new MissingInputException(file.toString());
            }
        }
    }

    private void startParsing(WorkerPool parsePool, ColumnCatalog catalog,
                              List<Path> files, BlockingSlots<RowBlock> slots)
    {
        RowBlockParser parser = options.getParser();
        int numFloat = catalog.getNumFloatColumns();
        int numString = catalog.getNumStringColumns();
        for (int i = 0; i < files.size(); ++i)
        {
            final int slot = i;
            final Path file = files.get(i);
            // the positions are cloned for each task, a parser may modify them
            final int[] floatPositions = catalog.getFloatFieldPositions();
            final int[] stringPositions = catalog.getStringFieldPositions();
            parsePool.submit(() -> {
                RowBlock block = parser.parse(file, floatPositions, stringPositions);
                if (block == null)
                {
                    throw new RowBlockParseException("parser returns no row block for '" + file + "'");
                }
                if (block.getNumFloatColumns() != numFloat || block.getNumStringColumns() != numString ||
                        !block.isConsistent())
                {
                    throw new RowBlockParseException("row block of '" + file +
                            "' does not match the layout of the columns");
                }
                return block;
            }).whenComplete((block, e) -> {
                if (e != null)
                {
                    slots.fail(unwrap(e));
                }
                else
                {
                    slots.put(slot, block);
                }
            });
        }
    }

    private static RowBlock takeBlock(BlockingSlots<RowBlock> slots, int index) throws TsvStoreException
    {
        try
        {
            return slots.take(index);
        }
        catch (BlockingSlots.SlotFailedException e)
        {
            throw toLoadException(e.getCause());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            throw new LoadFailedException("interrupted while waiting for row block " + index, e);
        }
    }

    private static void fanOut(WorkerPool columnPool, ColumnCatalog catalog, RowBlock block) throws TsvStoreException
    {
        List<CatalogEntry> entries = catalog.getEntries();
        CompletableFuture<?>[] futures = new CompletableFuture<?>[entries.size()];
        for (int i = 0; i < entries.size(); ++i)
        {
            CatalogEntry entry = entries.get(i);
            futures[i] = columnPool.execute(() -> entry.getColumn().add(entry.sliceOf(block)));
        }
        awaitAll(futures);
    }

    private static void finalizeColumns(WorkerPool columnPool, ColumnCatalog catalog) throws TsvStoreException
    {
        List<CatalogEntry> entries = catalog.getEntries();
        CompletableFuture<?>[] futures = new CompletableFuture<?>[entries.size()];
        for (int i = 0; i < entries.size(); ++i)
        {
            Column column = entries.get(i).getColumn();
            futures[i] = columnPool.execute(column::finalizeColumn);
        }
        awaitAll(futures);
    }

    /**
     * Wait for all the futures, and throw the failure that happens first if any fails.
     */
    private static void awaitAll(CompletableFuture<?>[] futures) throws TsvStoreException
    {
        AtomicReference<Throwable> firstFailure = new AtomicReference<>();
        CompletableFuture<?>[] recorded = new CompletableFuture<?>[futures.length];
        for (int i = 0; i < futures.length; ++i)
        {
            recorded[i] = futures[i].whenComplete((result, e) -> {
                if (e != null)
                {
                    firstFailure.compareAndSet(null, unwrap(e));
                }
            });
        }
        try
        {
            CompletableFuture.allOf(recorded).join();
        }
        catch (CompletionException e)
        {
            Throwable first = firstFailure.get();
            throw toLoadException(first != null ? first : unwrap(e));
        }
    }

    private static Throwable unwrap(Throwable e)
    {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) &&
                cause.getCause() != null)
        {
            cause = cause.getCause();
        }
        return cause;
    }

    private static TsvStoreException toLoadException(Throwable cause)
    {
        if (cause instanceof TsvStoreException)
        {
            return (TsvStoreException) cause;
        }
        if (cause instanceof IOException)
        {
            return new LoadFailedException("failed to read data file: " + cause.getMessage(), cause);
        }
        return new LoadFailedException("worker task failed: " + cause, cause);
    }
}
