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
package io.tsvstore.common.exception;

/**
 * Thrown before loading starts if the header file or any data file does not exist.
 */
public class MissingInputException extends TsvStoreException
{
    private static final long serialVersionUID = -1296873526711003874L;

    private final String path;

    public MissingInputException(String path)
    {
        super("input file '" + path + "' does not exist");
        this.path = path;
    }

    public String getPath()
    {
        return path;
    }
}
