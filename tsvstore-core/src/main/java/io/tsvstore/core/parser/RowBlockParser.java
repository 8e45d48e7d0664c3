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

import io.tsvstore.common.exception.RowBlockParseException;
import io.tsvstore.core.vector.RowBlock;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses one data file into one row block.
 * <p>
 * Implementations must be thread safe, the parse tasks of different files
 * call the same parser concurrently.
 * </p>
 */
public interface RowBlockParser
{
    /**
     * Parse the data file.
     * @param file the data file
     * @param floatFieldPositions the field position of float column i of the block is floatFieldPositions[i]
     * @param stringFieldPositions the field position of string column i of the block is stringFieldPositions[i]
     * @return the row block, whose vectors are laid out in the orders of the position arrays
     * and hold the same number of rows
     * @throws RowBlockParseException if the content of the file is malformed
     * @throws IOException if the file can not be read
     */
    RowBlock parse(Path file, int[] floatFieldPositions, int[] stringFieldPositions)
            throws RowBlockParseException, IOException;
}
