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
 * Thrown if a worker task of a load fails with an error that is not
 * a {@link TsvStoreException} itself, or if the loading thread is interrupted.
 */
public class LoadFailedException extends TsvStoreException
{
    private static final long serialVersionUID = -6002781135096438870L;

    public LoadFailedException(String message)
    {
        super(message);
    }

    public LoadFailedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
