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
 * Thrown by the parser if a data file can not be turned into a row block.
 */
public class RowBlockParseException extends TsvStoreException
{
    private static final long serialVersionUID = 8241904381150973502L;

    public RowBlockParseException(String message)
    {
        super(message);
    }

    public RowBlockParseException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public static RowBlockParseException atLine(String path, long lineNumber, String reason)
    {
        return new RowBlockParseException(path + ":" + lineNumber + ": " + reason);
    }

    public static RowBlockParseException atLine(String path, long lineNumber, String reason, Throwable cause)
    {
        return new RowBlockParseException(path + ":" + lineNumber + ": " + reason, cause);
    }
}
