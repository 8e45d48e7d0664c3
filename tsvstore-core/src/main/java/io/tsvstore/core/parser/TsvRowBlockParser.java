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
package io.tsvstore.core.parser;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import io.tsvstore.common.exception.RowBlockParseException;
import io.tsvstore.common.utils.ConfigFactory;
import io.tsvstore.common.utils.Constants;
import io.tsvstore.core.vector.FloatColumnVector;
import io.tsvstore.core.vector.RowBlock;
import io.tsvstore.core.vector.StringColumnVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.concurrent.ThreadSafe;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The parser of tab separated data files.
 * <p>
 * Empty lines are skipped. Every other line must have a field at each referenced
 * position. A float field that equals one of the null markers is loaded as NaN.
 * String fields are loaded as they are.
 * </p>
 */
@ThreadSafe
public class TsvRowBlockParser implements RowBlockParser
{
    private static final Logger logger = LogManager.getLogger(TsvRowBlockParser.class);

    private final Set<String> nullMarkers;

    public TsvRowBlockParser(Set<String> nullMarkers)
    {
        this.nullMarkers = ImmutableSet.copyOf(requireNonNull(nullMarkers, "nullMarkers is null"));
    }

    /**
     * Create a parser with the null markers in the tsv.null.markers property.
     */
    public static TsvRowBlockParser fromConfig(ConfigFactory configFactory)
    {
        String markers = configFactory.getProperty(Constants.NULL_MARKERS_KEY, Constants.DEFAULT_NULL_MARKERS);
        return new TsvRowBlockParser(parseNullMarkers(markers));
    }

    /**
     * Split the comma separated null markers, an empty item stands for the empty field.
     */
    public static Set<String> parseNullMarkers(String markers)
    {
        return ImmutableSet.copyOf(Splitter.on(',').trimResults().split(markers));
    }

    public Set<String> getNullMarkers()
    {
        return nullMarkers;
    }

    @Override
    public RowBlock parse(Path file, int[] floatFieldPositions, int[] stringFieldPositions)
            throws RowBlockParseException, IOException
    {
        requireNonNull(file, "file is null");
        requireNonNull(floatFieldPositions, "floatFieldPositions is null");
        requireNonNull(stringFieldPositions, "stringFieldPositions is null");
        String path = file.toString();
        int minFields = 0;
        for (int position : floatFieldPositions)
        {
            minFields = Math.max(minFields, position + 1);
        }
        for (int position : stringFieldPositions)
        {
            minFields = Math.max(minFields, position + 1);
        }

        RowBlock block = new RowBlock(path, floatFieldPositions.length, stringFieldPositions.length);
        List<String> fields = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null)
            {
                lineNumber++;
                if (line.isEmpty())
                {
                    continue;
                }
                split(line, fields);
                if (fields.size() < minFields)
                {
                    throw RowBlockParseException.atLine(path, lineNumber,
                            "expect at least " + minFields + " fields, but found " + fields.size());
                }
                for (int i = 0; i < floatFieldPositions.length; ++i)
                {
                    String field = fields.get(floatFieldPositions[i]);
                    FloatColumnVector vector = block.getFloatColumn(i);
                    if (nullMarkers.contains(field.trim()))
                    {
                        vector.addNull();
                        continue;
                    }
                    try
                    {
                        vector.add(field.trim());
                    }
                    catch (NumberFormatException e)
                    {
                        throw RowBlockParseException.atLine(path, lineNumber,
                                "field " + floatFieldPositions[i] + " '" + field + "' is not a float", e);
                    }
                }
                for (int i = 0; i < stringFieldPositions.length; ++i)
                {
                    StringColumnVector vector = block.getStringColumn(i);
                    vector.add(fields.get(stringFieldPositions[i]));
                }
                block.finishRow();
            }
        }
        logger.debug("parsed " + block.getNumRows() + " rows from " + path);
        return block;
    }

    /**
     * Split the line by tabs into the reused list. Trailing empty fields are kept.
     */
    private static void split(String line, List<String> fields)
    {
        fields.clear();
        int start = 0;
        int end;
        while ((end = line.indexOf(Constants.FIELD_DELIMITER, start)) >= 0)
        {
            fields.add(line.substring(start, end));
            start = end + 1;
        }
        fields.add(line.substring(start));
    }
}
