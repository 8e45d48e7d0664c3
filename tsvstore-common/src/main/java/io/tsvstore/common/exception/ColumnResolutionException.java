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
 * Thrown if a configured column can not be found in the header file.
 */
public class ColumnResolutionException extends InvalidConfigException
{
    private static final long serialVersionUID = 5470127734283901866L;

    private final String columnName;

    public ColumnResolutionException(String columnName)
    {
        super("failed to find column '" + columnName + "' in header file");
        this.columnName = columnName;
    }

    public String getColumnName()
    {
        return columnName;
    }
}
