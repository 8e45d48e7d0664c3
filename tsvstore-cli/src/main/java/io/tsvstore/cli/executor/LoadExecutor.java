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
package io.tsvstore.cli.executor;

import com.google.common.base.Stopwatch;
import io.tsvstore.cli.Session;
import io.tsvstore.common.exception.MissingInputException;
import io.tsvstore.common.exception.TsvStoreException;
import io.tsvstore.common.utils.ConfigFactory;
import io.tsvstore.common.utils.Constants;
import io.tsvstore.core.catalog.ColumnConfig;
import io.tsvstore.core.parser.TsvRowBlockParser;
import io.tsvstore.core.pipeline.ColumnStore;
import io.tsvstore.core.pipeline.IngestionPipeline;
import io.tsvstore.core.pipeline.PipelineOptions;
import net.sourceforge.argparse4j.inf.Namespace;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * LOAD -h header.tsv -i data_dir -b a -r c -s b -c 8
 * <p>
 * The columns are given by -b, -r and -s, or by the properties file of -f, or by
 * the configuration of tsvstore if neither is given. A directory in -i stands for
 * the regular files in it, sorted by name.
 * </p>
 */
public class LoadExecutor implements CommandExecutor
{
    private final Session session;

    public LoadExecutor(Session session)
    {
        this.session = requireNonNull(session, "session is null");
    }

    @Override
    public void execute(Namespace ns, String command) throws Exception
    {
        Path headerFile = Paths.get(ns.getString("header"));
        List<String> inputs = ns.getList("input");
        String binned = ns.getString("binned");
        String raw = ns.getString("raw");
        String strings = ns.getString("string");
        String propsFile = ns.getString("properties");
        Integer threadNum = ns.getInt("concurrency");

        ConfigFactory configFactory = ConfigFactory.Instance();
        PipelineOptions.Builder optionsBuilder = PipelineOptions.newBuilder(configFactory);
        ColumnConfig columnConfig;
        if (binned != null || raw != null || strings != null)
        {
            columnConfig = ColumnConfig.newBuilder()
                    .addBinnedFloatColumns(ColumnConfig.splitNames(binned))
                    .addRawFloatColumns(ColumnConfig.splitNames(raw))
                    .addStringColumns(ColumnConfig.splitNames(strings))
                    .build();
        }
        else if (propsFile != null)
        {
            Properties properties = readProperties(Paths.get(propsFile));
            columnConfig = ColumnConfig.fromProperties(properties);
            applyOptions(properties, optionsBuilder);
        }
        else
        {
            columnConfig = ColumnConfig.fromConfigFactory(configFactory);
        }
        if (threadNum != null)
        {
            optionsBuilder.setNumThreads(threadNum);
        }
        PipelineOptions options = optionsBuilder.build();

        List<Path> dataFiles = expandInputs(inputs);
        System.out.println("loading " + dataFiles.size() + " files with " + options.getNumThreads() +
                " threads per pool, columns: " + columnConfig);

        Stopwatch stopwatch = Stopwatch.createStarted();
        ColumnStore store;
        try
        {
            store = new IngestionPipeline(options).load(headerFile, dataFiles, columnConfig);
        }
        catch (TsvStoreException e)
        {
            System.err.println(command + " failed: " + e.getMessage());
            return;
        }
        session.setStore(store);
        System.out.println(store.describe());
        System.out.println(command + " is successful");
        System.out.println("Files are loaded by " + options.getNumThreads() + " threads in " +
                stopwatch.elapsed(TimeUnit.MILLISECONDS) / 1000.0 + "s.");
    }

    /**
     * Replace each directory in the inputs by the regular files in it, sorted by name.
     * Other inputs are kept as they are, the pipeline checks whether they exist.
     */
    public static List<Path> expandInputs(List<String> inputs) throws IOException
    {
        List<Path> files = new ArrayList<>();
        for (String input : inputs)
        {
            Path path = Paths.get(input);
            if (Files.isDirectory(path))
            {
                try (Stream<Path> children = Files.list(path))
                {
                    files.addAll(children.filter(Files::isRegularFile).sorted(
                            (p1, p2) -> p1.getFileName().toString().compareTo(p2.getFileName().toString()))
                            .collect(Collectors.toList()));
                }
            }
            else
            {
                files.add(path);
            }
        }
        return files;
    }

    private static Properties readProperties(Path file) throws MissingInputException, IOException
    {
        if (!Files.isRegularFile(file))
        {
            throw new MissingInputException(file.toString());
        }
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file))
        {
            properties.load(in);
        }
        return properties;
    }

    private static void applyOptions(Properties properties, PipelineOptions.Builder builder)
    {
        String numThreads = properties.getProperty(Constants.NUM_THREADS_KEY);
        if (numThreads != null)
        {
            builder.setNumThreads(Integer.parseInt(numThreads.trim()));
        }
        String maxBins = properties.getProperty(Constants.BINNED_MAX_BINS_KEY);
        if (maxBins != null)
        {
            builder.setMaxBins(Integer.parseInt(maxBins.trim()));
        }
        String nullMarkers = properties.getProperty(Constants.NULL_MARKERS_KEY);
        if (nullMarkers != null)
        {
            builder.setParser(new TsvRowBlockParser(TsvRowBlockParser.parseNullMarkers(nullMarkers)));
        }
    }
}
