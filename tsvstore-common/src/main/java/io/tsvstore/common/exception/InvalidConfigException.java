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
 * Thrown if the column configuration or the pipeline options are invalid,
 * e.g., a column name is declared twice.
 */
public class InvalidConfigException extends TsvStoreException
{
    private static final long serialVersionUID = -3718042977652108419L;

    public InvalidConfigException(String message)
    {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
