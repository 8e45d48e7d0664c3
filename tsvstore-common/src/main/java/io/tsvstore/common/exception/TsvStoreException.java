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
 * The base of the checked exceptions thrown while setting up or running a load.
 */
public class TsvStoreException extends Exception
{
    private static final long serialVersionUID = 2690284163591740412L;

    public TsvStoreException()
    {
        super();
    }

    public TsvStoreException(String message)
    {
        super(message);
    }

    public TsvStoreException(Throwable cause)
    {
        super(cause);
    }

    public TsvStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
