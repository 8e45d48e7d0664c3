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
import io.tsvstore.common.exception.MissingInputException;
import io.tsvstore.common.utils.Constants;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The mapping from the column names in the header file to their 0-based
 * positions in the lines of every data file.
 * <p>
 * The header is one line of tab separated names, each name is trimmed. If a
 * name appears more than once, the last position wins.
 * </p>
 */
public class HeaderIndex
{
    private static final Logger logger = LogManager.getLogger(HeaderIndex.class);

    private final List<String> names;
    private final Map<String, Integer> positions;

    private HeaderIndex(List<String> names)
    {
        this.names = ImmutableList.copyOf(names);
        this.positions = new HashMap<>(names.size());
        for (int i = 0; i < names.size(); ++i)
        {
            Integer previous = this.positions.put(names.get(i), i);
            if (previous != null)
            {
                logger.warn("column '" + names.get(i) + "' appears at position " + previous +
                        " and " + i + " of the header, position " + i + " is used");
            }
        }
    }

    public static HeaderIndex parse(String headerLine)
    {
        requireNonNull(headerLine, "headerLine is null");
        return new HeaderIndex(Splitter.on(Constants.FIELD_DELIMITER).trimResults().splitToList(headerLine));
    }

    /**
     * Read the first line of the header file.
     * @param headerFile the path of the header file
     * @return the header index
     * @throws MissingInputException if the header file does not exist
     * @throws IOException if the header file can not be read
     */
    public static HeaderIndex fromFile(Path headerFile) throws MissingInputException, IOException
    {
        requireNonNull(headerFile, "headerFile is null");
        if (!Files.isRegularFile(headerFile))
        {
            throw new MissingInputException(headerFile.toString());
        }
        try (BufferedReader reader = Files.newBufferedReader(headerFile, StandardCharsets.UTF_8))
        {
            String line = reader.readLine();
            return parse(line == null ? "" : line);
        }
    }

    /**
     * @return the position of the column, or -1 if the column is not in the header
     */
    public int getPosition(String name)
    {
        Integer position = positions.get(name);
        return position == null ? -1 : position;
    }

    public boolean contains(String name)
    {
        return positions.containsKey(name);
    }

    public int getNumColumns()
    {
        return names.size();
    }

    /**
     * @return the names in the order of the header
     */
    public List<String> getNames()
    {
        return names;
    }

    @Override
    public String toString()
    {
        return "HeaderIndex" + names;
    }
}
